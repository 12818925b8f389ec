package org.hcpdata.extractor.engagement.mapper;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.lang3.math.NumberUtils;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawRecord;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.hcpdata.extractor.engagement.util.Constants;
import org.springframework.stereotype.Component;

/**
 * Last-mile-reach (LMMR) broadcasts. Output is ordered by HCP, date, service id and action.
 * Identifiers made only of digits compare as numbers and sort before all other identifiers.
 */
@Component
public class ReachSchemaMapper extends AbstractSchemaMapper {

    static final String HCP_ID_FIELD = "customer_id";
    static final String DATE_FIELD = "activity_date";
    static final String ID_FIELD = "sevc_id";
    static final String ACTION_FIELD = "action";

    static final Comparator<String> IDENTIFIER_ORDER = Comparator
        .comparing((String identifier) -> !NumberUtils.isDigits(identifier))
        .thenComparing(identifier -> NumberUtils.isDigits(identifier) ? new BigInteger(identifier) : BigInteger.ZERO)
        .thenComparing(Comparator.naturalOrder());

    private static final Comparator<CanonicalEngagement> ORDER = Comparator
        .comparing(CanonicalEngagement::hcpId, IDENTIFIER_ORDER)
        .thenComparing(CanonicalEngagement::activityDate)
        .thenComparing(CanonicalEngagement::id, IDENTIFIER_ORDER)
        .thenComparing(CanonicalEngagement::action);

    @Override
    public SourceType sourceType() {
        return SourceType.REACH;
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
            Constants.REACH_CHANNEL,
            record.get(ACTION_FIELD)
        );
    }

    @Override
    protected List<CanonicalEngagement> postProcess(List<CanonicalEngagement> mapped) {
        return mapped.stream().sorted(ORDER).toList();
    }
}
