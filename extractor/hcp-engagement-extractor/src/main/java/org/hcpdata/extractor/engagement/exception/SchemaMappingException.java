package org.hcpdata.extractor.engagement.exception;

import org.hcpdata.extractor.engagement.model.SourceType;

/**
 * Exception thrown when a source table lacks a field its mapper requires.
 */
public class SchemaMappingException extends EngagementPipelineException {
    public SchemaMappingException(SourceType source, String message) {
        super(source, message, null);
    }
}
