package org.hcpdata.extractor.engagement.exception;

import org.hcpdata.extractor.engagement.model.SourceType;

/**
 * Exception thrown when the raw data for a source cannot be obtained.
 */
public class SourceUnavailableException extends EngagementPipelineException {
    public SourceUnavailableException(SourceType source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
