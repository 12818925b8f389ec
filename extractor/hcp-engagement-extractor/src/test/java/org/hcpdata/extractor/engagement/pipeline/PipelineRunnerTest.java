package org.hcpdata.extractor.engagement.pipeline;

import static org.hcpdata.extractor.engagement.support.RawTables.filters;
import static org.hcpdata.extractor.engagement.support.RawTables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.hcpdata.extractor.engagement.exception.SchemaMappingException;
import org.hcpdata.extractor.engagement.mapper.SchemaMapperRegistry;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.hcpdata.extractor.engagement.util.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineRunnerTest {

    private static final LocalDate REFERENCE_DATE = LocalDate.of(2024, 10, 18);
    private static final String REACH_HEADER = "customer_id,activity_date,sevc_id,action";

    private SimpleMeterRegistry meterRegistry;
    private PipelineRunner pipelineRunner;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        pipelineRunner = new PipelineRunner(SchemaMapperRegistry.withDefaultMappers(), meterRegistry);
    }

    private double count(SourceType source, String status) {
        return meterRegistry.get(Constants.RECORD_COUNTER)
            .tag("source", source.getConfigKey())
            .tag("status", status)
            .counter()
            .count();
    }

    @Test
    void testRun_octoberWithSevenMonthsStartsInMarch() throws SchemaMappingException {
        List<CanonicalEngagement> result = pipelineRunner.run(SourceType.REACH, table(REACH_HEADER,
            "HCP1,2024-02-29,S1,Delivered",
            "HCP1,2024-03-01,S2,Delivered",
            "HCP1,2031-01-01,S3,Delivered"
        ), filters(7, REFERENCE_DATE));

        assertEquals(List.of("S2", "S3"), result.stream().map(CanonicalEngagement::id).toList());
        assertEquals(3, count(SourceType.REACH, "read"));
        assertEquals(3, count(SourceType.REACH, "mapped"));
        assertEquals(1, count(SourceType.REACH, "expired"));
        assertEquals(0, count(SourceType.REACH, "refined_out"));
        assertEquals(2, count(SourceType.REACH, "retained"));
    }

    @Test
    void testConstructor_countersStartAtZero() {
        for (SourceType source : SourceType.values()) {
            for (String status : List.of("read", "mapped", "expired", "refined_out", "retained")) {
                assertEquals(0, count(source, status), source + " " + status);
            }
        }
    }

    @Test
    void testRun_everyFieldPopulated() throws SchemaMappingException {
        List<CanonicalEngagement> result = pipelineRunner.run(SourceType.CALL, table(
            "child_account_identifier_vod__c,call_date_vod__c,call2_vod_id,Action",
            "HCP1,2024-09-01,C1,Attended",
            "HCP2,9/2/2024,C2,",
            "HCP3,20240903,,Attended"
        ), filters(7, REFERENCE_DATE));

        assertEquals(3, result.size());
        for (CanonicalEngagement engagement : result) {
            assertNotNull(engagement.hcpId());
            assertFalse(engagement.hcpId().isEmpty());
            assertNotNull(engagement.activityDate());
            assertEquals(YearMonth.from(engagement.activityDate()).toString(), engagement.yrmo());
            assertNotNull(engagement.id());
            assertNotNull(engagement.channel());
            assertNotNull(engagement.action());
        }
    }

    @Test
    void testRun_edetailDropsActivitiesWhoseDeliveryExpired() throws SchemaMappingException {
        List<CanonicalEngagement> result = pipelineRunner.run(SourceType.EDETAIL, table(
            "src_systm_cd,dgtl_dtl_only_id,action,activity_date,customer_id,product_name",
            "M3,E1,Sent,2024-02-28,HCP1,EBG",
            "M3,E1,Opened,2024-03-02,HCP1,EBG",
            "M3,E2,Sent,2024-04-01,HCP2,EBG",
            "M3,E2,Opened,2024-04-01,HCP2,EBG"
        ), filters(7, REFERENCE_DATE));

        assertEquals(List.of("E2/Delivered", "E2/Opened"),
            result.stream().map(engagement -> engagement.id() + "/" + engagement.action()).toList());
        assertEquals(4, count(SourceType.EDETAIL, "mapped"));
        assertEquals(1, count(SourceType.EDETAIL, "expired"));
        assertEquals(1, count(SourceType.EDETAIL, "refined_out"));
        assertEquals(2, count(SourceType.EDETAIL, "retained"));
        assertEquals(count(SourceType.EDETAIL, "mapped"), count(SourceType.EDETAIL, "expired")
            + count(SourceType.EDETAIL, "refined_out") + count(SourceType.EDETAIL, "retained"));
    }

    @Test
    void testRun_retentionIsInclusiveForEveryWindow() throws SchemaMappingException {
        List<String> rows = new ArrayList<>();
        for (LocalDate date = LocalDate.of(2023, 1, 1); date.isBefore(LocalDate.of(2025, 6, 1)); date = date.plusDays(10)) {
            rows.add("HCP1," + date + ",S" + rows.size() + ",Delivered");
        }
        RawTable reach = table(REACH_HEADER, rows.toArray(new String[0]));

        for (int months : List.of(0, 1, 7, 12)) {
            LocalDate cutoff = REFERENCE_DATE.withDayOfMonth(1).minusMonths(months);
            List<CanonicalEngagement> result = pipelineRunner.run(SourceType.REACH, reach, filters(months, REFERENCE_DATE));

            long expected = reach.rows().stream()
                .map(row -> LocalDate.parse(row.get("activity_date")))
                .filter(date -> !date.isBefore(cutoff))
                .count();
            assertEquals(expected, result.size(), "months=" + months);
            result.forEach(engagement -> assertFalse(engagement.activityDate().isBefore(cutoff)));
        }
    }

    @Test
    void testRun_callKeepsInputOrder() throws SchemaMappingException {
        List<CanonicalEngagement> result = pipelineRunner.run(SourceType.CALL, table(
            "child_account_identifier_vod__c,call_date_vod__c,call2_vod_id,Action",
            "HCP3,2024-09-01,C3,Attended",
            "HCP1,2024-08-01,C1,Attended",
            "HCP2,2024-10-01,C2,Attended"
        ), filters(7, REFERENCE_DATE));

        assertEquals(List.of("C3", "C1", "C2"), result.stream().map(CanonicalEngagement::id).toList());
    }
}
