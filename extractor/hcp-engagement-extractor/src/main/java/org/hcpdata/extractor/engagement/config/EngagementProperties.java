package org.hcpdata.extractor.engagement.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code hcp}: the output locations and one entry per source under {@code hcp.sources}.
 * Filter keys containing underscores must be bracketed in YAML, e.g. {@code "[product_id]": P1}.
 */
@ConfigurationProperties(prefix = "hcp")
public class EngagementProperties {

    private boolean runOnStartup = true;
    private String outputDir;
    private String unifiedOutput;
    private Map<String, SourceProperties> sources = new LinkedHashMap<>();

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getUnifiedOutput() {
        return unifiedOutput;
    }

    public void setUnifiedOutput(String unifiedOutput) {
        this.unifiedOutput = unifiedOutput;
    }

    public Map<String, SourceProperties> getSources() {
        return sources;
    }

    public void setSources(Map<String, SourceProperties> sources) {
        this.sources = sources;
    }

    /**
     * Settings of a single source.
     */
    public static class SourceProperties {
        private String path;
        private String output;
        private Map<String, String> filters = new LinkedHashMap<>();

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public Map<String, String> getFilters() {
            return filters;
        }

        public void setFilters(Map<String, String> filters) {
            this.filters = filters;
        }
    }
}
