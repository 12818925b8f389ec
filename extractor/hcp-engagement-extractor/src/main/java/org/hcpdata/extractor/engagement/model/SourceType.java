package org.hcpdata.extractor.engagement.model;

/**
 * The engagement sources, declared in the order they are run and consolidated.
 */
public enum SourceType {
    CALL("call"),
    EDETAIL("edetail"),
    EVENTS("events"),
    REACH("reach");

    private final String configKey;

    SourceType(String configKey) {
        this.configKey = configKey;
    }

    /**
     * Key of this source under {@code hcp.sources} and in metric tags.
     *
     * @return the configuration key
     */
    public String getConfigKey() {
        return configKey;
    }
}
