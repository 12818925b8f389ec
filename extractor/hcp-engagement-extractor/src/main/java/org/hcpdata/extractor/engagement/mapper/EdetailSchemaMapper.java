package org.hcpdata.extractor.engagement.mapper;

import static org.hcpdata.extractor.engagement.util.Constants.CLICKED;
import static org.hcpdata.extractor.engagement.util.Constants.DELIVERED;
import static org.hcpdata.extractor.engagement.util.Constants.OPENED;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawRecord;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.springframework.stereotype.Component;

/**
 * Digital detailing and email platforms. The {@code src_systm_cd} column names the platform, which decides the
 * channel label and how the platform's actions are turned into canonical ones:
 *
 * <ul>
 *   <li>eCare platforms (CARENET, Medpeer) report Delivered and Opened,</li>
 *   <li>M3 email variants report Delivered, Opened and Clicked,</li>
 *   <li>NMO rows pass through one to one, with Viewed reported as Opened.</li>
 * </ul>
 *
 * <p>For eCare and M3 the rows of one activity (date, HCP, id, channel) are grouped and an action is reported
 * when the group holds exactly one row with it. Other platforms, JSTREAM included, produce nothing.
 * After the retention window, only activities with a Delivered record are kept.
 */
@Component
public class EdetailSchemaMapper extends AbstractSchemaMapper {

    static final String PLATFORM_FIELD = "src_systm_cd";
    static final String HCP_ID_FIELD = "customer_id";
    static final String DATE_FIELD = "activity_date";
    static final String ID_FIELD = "dgtl_dtl_only_id";
    static final String ACTION_FIELD = "action";
    static final String PRODUCT_FIELD = "product_name";

    static final Map<String, String> CHANNEL_MAPPING = Map.of(
        "M3", "EMAIL_M3_MR_KUN",
        "M3-Quiz", "EMAIL_M3_QUIZ",
        "M3-MM", "EMAIL_M3_MM",
        "NMO", "EDETAIL_NMO",
        "M3-OPD", "EMAIL_M3_OPD",
        "CARENET", "EDETAIL_CARENET",
        "JSTREAM", "EDETAIL_JSTREAM",
        "Medpeer", "EDETAIL_MEDPEER"
    );

    private static final Map<String, String> ACTION_MAPPING = Map.of("Sent", DELIVERED);

    private static final Set<String> ECARE_CHANNELS = Set.of("EDETAIL_CARENET", "EDETAIL_MEDPEER");
    private static final Set<String> M3_CHANNELS = Set.of("EMAIL_M3_MR_KUN", "EMAIL_M3_OPD", "EMAIL_M3_QUIZ", "EMAIL_M3_MM");
    private static final String NMO_CHANNEL = "EDETAIL_NMO";
    private static final String NMO_VIEWED = "Viewed";

    private static final Comparator<ActivityKey> KEY_ORDER = Comparator
        .comparing(ActivityKey::activityDate)
        .thenComparing(ActivityKey::hcpId)
        .thenComparing(ActivityKey::id)
        .thenComparing(ActivityKey::channel);

    private record ActivityKey(LocalDate activityDate, String hcpId, String id, String channel) {}

    @Override
    public SourceType sourceType() {
        return SourceType.EDETAIL;
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
        return List.of(PLATFORM_FIELD, ACTION_FIELD, PRODUCT_FIELD);
    }

    /**
     * Normalizes the channel label and the raw action; unknown platforms keep their code as the channel.
     */
    @Override
    protected CanonicalEngagement toEngagement(RawRecord record, LocalDate activityDate) {
        String platform = record.get(PLATFORM_FIELD);
        String action = record.get(ACTION_FIELD);
        return CanonicalEngagement.of(
            record.get(HCP_ID_FIELD),
            activityDate,
            record.get(ID_FIELD),
            CHANNEL_MAPPING.getOrDefault(platform, platform),
            ACTION_MAPPING.getOrDefault(action, action)
        );
    }

    @Override
    protected List<CanonicalEngagement> postProcess(List<CanonicalEngagement> mapped) {
        List<CanonicalEngagement> result = new ArrayList<>();
        result.addAll(singleActions(mapped, ECARE_CHANNELS, List.of(DELIVERED, OPENED)));
        result.addAll(singleActions(mapped, M3_CHANNELS, List.of(DELIVERED, OPENED, CLICKED)));
        result.addAll(nmo(mapped));
        return result;
    }

    @Override
    public List<CanonicalEngagement> refineRetained(List<CanonicalEngagement> retained) {
        Set<String> deliveredIds = retained.stream()
            .filter(engagement -> DELIVERED.equals(engagement.action()))
            .map(CanonicalEngagement::id)
            .collect(Collectors.toSet());
        return retained.stream()
            .filter(engagement -> deliveredIds.contains(engagement.id()))
            .toList();
    }

    /**
     * Reports each action once per activity, when exactly one row of the activity carries it.
     * Output is grouped by action, in the order given, and by activity key within an action.
     */
    private static List<CanonicalEngagement> singleActions(List<CanonicalEngagement> mapped, Set<String> channels, List<String> actions) {
        Map<ActivityKey, Map<String, Integer>> actionCounts = new TreeMap<>(KEY_ORDER);
        for (CanonicalEngagement engagement : mapped) {
            if (!channels.contains(engagement.channel())) {
                continue;
            }
            ActivityKey key = new ActivityKey(engagement.activityDate(), engagement.hcpId(), engagement.id(), engagement.channel());
            actionCounts.computeIfAbsent(key, k -> new HashMap<>()).merge(engagement.action(), 1, Integer::sum);
        }

        List<CanonicalEngagement> result = new ArrayList<>();
        for (String action : actions) {
            actionCounts.forEach((key, counts) -> {
                if (counts.getOrDefault(action, 0) == 1) {
                    result.add(CanonicalEngagement.of(key.hcpId(), key.activityDate(), key.id(), key.channel(), action));
                }
            });
        }
        return result;
    }

    // Only Viewed is renamed; any other NMO action is reported as exported
    private static List<CanonicalEngagement> nmo(List<CanonicalEngagement> mapped) {
        return mapped.stream()
            .filter(engagement -> NMO_CHANNEL.equals(engagement.channel()))
            .map(engagement -> NMO_VIEWED.equals(engagement.action()) ? engagement.withAction(OPENED) : engagement)
            .toList();
    }
}
