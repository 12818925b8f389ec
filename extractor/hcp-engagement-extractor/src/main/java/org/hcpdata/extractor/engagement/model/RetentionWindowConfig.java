package org.hcpdata.extractor.engagement.model;

import java.time.LocalDate;
import java.util.Objects;
import org.hcpdata.extractor.engagement.util.DateEngine;

/**
 * Rolling retention window of a source.
 *
 * @param monthsToRetain whole months kept before the reference month; zero keeps the reference month onward
 * @param referenceDate  calendar date of the run start
 */
public record RetentionWindowConfig(int monthsToRetain, LocalDate referenceDate) {

    public RetentionWindowConfig {
        if (monthsToRetain < 0) {
            throw new IllegalArgumentException("monthsToRetain must not be negative, was " + monthsToRetain);
        }
        Objects.requireNonNull(referenceDate, "referenceDate");
    }

    /**
     * First day that is still retained.
     *
     * @return the inclusive lower bound of the window
     */
    public LocalDate cutoff() {
        return DateEngine.retentionCutoff(monthsToRetain, referenceDate);
    }

    public boolean retains(LocalDate activityDate) {
        return DateEngine.withinRetention(activityDate, monthsToRetain, referenceDate);
    }
}
