package org.hcpdata.extractor.engagement.model;

/**
 * Outcome of a record as it moves through a source pipeline. Used as a metric tag.
 * Every mapped record ends up expired, refined out or retained.
 */
public enum RecordStatus {
    READ("read"),
    MAPPED("mapped"),
    EXPIRED("expired"),
    REFINED_OUT("refined_out"),
    RETAINED("retained");

    private final String status;

    RecordStatus(String status) {
        this.status = status;
    }

    public String getStatus() {
        return status;
    }
}
