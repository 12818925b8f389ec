package org.hcpdata.extractor.engagement.exception;

/**
 * Exception thrown when a raw date value matches none of the accepted formats.
 */
public class DateFormatException extends EngagementPipelineException {

    private final String rawValue;

    /**
     * Constructs a new DateFormatException for the rejected value.
     *
     * @param rawValue the value that could not be parsed
     */
    public DateFormatException(String rawValue) {
        super("Unparseable date '" + rawValue + "'");
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
