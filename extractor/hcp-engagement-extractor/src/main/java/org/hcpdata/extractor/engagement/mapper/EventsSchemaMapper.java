package org.hcpdata.extractor.engagement.mapper;

import java.time.LocalDate;
import java.util.List;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawRecord;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.springframework.stereotype.Component;

/**
 * Conference events. Channel and action are already canonical in the export; rows without a channel are dropped.
 */
@Component
public class EventsSchemaMapper extends AbstractSchemaMapper {

    static final String HCP_ID_FIELD = "customer_id";
    static final String DATE_FIELD = "ACTVY_STRT_DT";
    static final String ID_FIELD = "conference_id";
    static final String CHANNEL_FIELD = "channel";
    static final String ACTION_FIELD = "action";

    @Override
    public SourceType sourceType() {
        return SourceType.EVENTS;
    }

    @Override
    protected String hcpIdField() {
        return HCP_ID_FIELD;
    }

    @Override
    protected String dateField() {
        return DATE_FIELD;
    }

    @Override
    protected String idField() {
        return ID_FIELD;
    }

    @Override
    protected List<String> additionalFields() {
        return List.of(CHANNEL_FIELD, ACTION_FIELD);
    }

    @Override
    protected boolean accept(RawRecord record) {
        return !record.get(CHANNEL_FIELD).isEmpty();
    }

    @Override
    protected CanonicalEngagement toEngagement(RawRecord record, LocalDate activityDate) {
        return CanonicalEngagement.of(
            record.get(HCP_ID_FIELD),
            activityDate,
            record.get(ID_FIELD),
            record.get(CHANNEL_FIELD),
            record.get(ACTION_FIELD)
        );
    }
}
