package org.hcpdata.extractor.engagement.exception;

import org.hcpdata.extractor.engagement.model.SourceType;

/**
 * Exception thrown when a source's configuration is missing required values or holds invalid ones.
 */
public class InvalidConfigurationException extends EngagementPipelineException {
    public InvalidConfigurationException(SourceType source, String message) {
        super(source, message, null);
    }
}
