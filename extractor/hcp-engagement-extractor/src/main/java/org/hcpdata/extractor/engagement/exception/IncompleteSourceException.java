package org.hcpdata.extractor.engagement.exception;

import java.util.List;
import java.util.stream.Collectors;
import org.hcpdata.extractor.engagement.model.SourceType;

/**
 * Exception thrown when consolidation is attempted before every source produced its records.
 */
public class IncompleteSourceException extends EngagementPipelineException {

    private final List<SourceType> missingSources;

    /**
     * Constructs a new IncompleteSourceException.
     *
     * @param missingSources the sources with no result
     */
    public IncompleteSourceException(List<SourceType> missingSources) {
        super("No result for sources " + missingSources.stream()
            .map(SourceType::getConfigKey)
            .collect(Collectors.joining(", ")));
        this.missingSources = List.copyOf(missingSources);
    }

    public List<SourceType> getMissingSources() {
        return missingSources;
    }
}
