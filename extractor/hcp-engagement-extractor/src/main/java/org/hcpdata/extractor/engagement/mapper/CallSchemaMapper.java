package org.hcpdata.extractor.engagement.mapper;

import java.time.LocalDate;
import java.util.List;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawRecord;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.hcpdata.extractor.engagement.util.Constants;
import org.springframework.stereotype.Component;

/**
 * Face-to-face and virtual calls. The record type does not change the canonical channel.
 */
@Component
public class CallSchemaMapper extends AbstractSchemaMapper {

    static final String HCP_ID_FIELD = "child_account_identifier_vod__c";
    static final String DATE_FIELD = "call_date_vod__c";
    static final String ID_FIELD = "call2_vod_id";
    static final String ACTION_FIELD = "Action";

    @Override
    public SourceType sourceType() {
        return SourceType.CALL;
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
        return List.of(ACTION_FIELD);
    }

    @Override
    protected CanonicalEngagement toEngagement(RawRecord record, LocalDate activityDate) {
        return CanonicalEngagement.of(
            record.get(HCP_ID_FIELD),
            activityDate,
            record.get(ID_FIELD),
            Constants.CALL_CHANNEL,
            record.get(ACTION_FIELD)
        );
    }
}
