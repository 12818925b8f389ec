package org.hcpdata.extractor.engagement.exception;

import org.hcpdata.extractor.engagement.model.SourceType;

/**
 * Base exception for failures while extracting HCP engagement data.
 */
public class EngagementPipelineException extends Exception {

    private final SourceType source;

    /**
     * Constructs a new EngagementPipelineException that is not tied to a single source.
     *
     * @param message the detail message
     */
    public EngagementPipelineException(String message) {
        this(null, message, null);
    }

    /**
     * Constructs a new EngagementPipelineException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public EngagementPipelineException(String message, Throwable cause) {
        this(null, message, cause);
    }

    /**
     * Constructs a new EngagementPipelineException for a source.
     *
     * @param source  the source whose pipeline failed, or null
     * @param message the detail message
     * @param cause   the underlying cause, or null
     */
    public EngagementPipelineException(SourceType source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * The source whose pipeline raised this exception.
     *
     * @return the source, or null when the failure is not tied to one source
     */
    public SourceType getSource() {
        return source;
    }
}
