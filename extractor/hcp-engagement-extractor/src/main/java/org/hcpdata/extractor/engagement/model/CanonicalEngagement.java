package org.hcpdata.extractor.engagement.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.hcpdata.extractor.engagement.util.DateEngine;

/**
 * A single HCP engagement in the shared six-column shape.
 *
 * @param hcpId        healthcare professional identifier
 * @param activityDate calendar date of the engagement
 * @param yrmo         {@code YYYY-MM} label of {@code activityDate}
 * @param id           identifier of the originating activity
 * @param channel      channel label
 * @param action       engagement verb
 */
public record CanonicalEngagement(
    String hcpId,
    LocalDate activityDate,
    String yrmo,
    String id,
    String channel,
    String action
) {

    public static final List<String> COLUMNS = List.of("HCP_ID", "ACTIVITY_DATE", "YRMO", "ID", "CHANNEL", "ACTION");

    public CanonicalEngagement {
        if (StringUtils.isBlank(hcpId)) {
            throw new IllegalArgumentException("hcpId must not be blank");
        }
        Objects.requireNonNull(activityDate, "activityDate");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(action, "action");
        if (!DateEngine.toYrmo(activityDate).equals(yrmo)) {
            throw new IllegalArgumentException("yrmo " + yrmo + " does not match activity date " + activityDate);
        }
    }

    /**
     * Creates an engagement, deriving its year-month label from the activity date.
     */
    public static CanonicalEngagement of(String hcpId, LocalDate activityDate, String id, String channel, String action) {
        return new CanonicalEngagement(hcpId, activityDate, DateEngine.toYrmo(activityDate), id, channel, action);
    }

    public CanonicalEngagement withAction(String newAction) {
        return of(hcpId, activityDate, id, channel, newAction);
    }

    /**
     * Values in {@link #COLUMNS} order, dates as {@code YYYY-MM-DD}.
     *
     * @return the serialized row
     */
    public List<String> toRow() {
        return List.of(hcpId, activityDate.toString(), yrmo, id, channel, action);
    }
}
