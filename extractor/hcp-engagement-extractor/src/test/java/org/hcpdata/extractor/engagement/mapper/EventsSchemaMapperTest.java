package org.hcpdata.extractor.engagement.mapper;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hcpdata.extractor.engagement.support.RawTables.filters;
import static org.hcpdata.extractor.engagement.support.RawTables.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.util.List;
import org.hcpdata.extractor.engagement.exception.SchemaMappingException;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.junit.jupiter.api.Test;

class EventsSchemaMapperTest {

    private static final LocalDate REFERENCE_DATE = LocalDate.of(2024, 10, 18);
    private static final String HEADER = "customer_id,ACTVY_STRT_DT,conference_id,channel,action,product_id,indication_id";

    private final EventsSchemaMapper mapper = new EventsSchemaMapper();

    @Test
    void testMap_copiesChannelAndActionAndAppliesAllFilters() throws SchemaMappingException {
        List<CanonicalEngagement> mapped = mapper.map(table(HEADER,
            "HCP1,2024-04-15 09:00:00,EV1,WEBCAST,Registered,P1,I1",
            "HCP2,2024-04-15,EV2,EVENT,Attended,P1,I2",
            "HCP3,2024-04-15,EV3,EVENT,Attended,P2,I1"
        ), filters(7, REFERENCE_DATE, "product_id", "P1", "indication_id", "I1"));

        assertEquals(List.of(
            CanonicalEngagement.of("HCP1", LocalDate.of(2024, 4, 15), "EV1", "WEBCAST", "Registered")
        ), mapped);
    }

    @Test
    void testMap_blankChannelDropped() throws SchemaMappingException {
        List<CanonicalEngagement> mapped = mapper.map(table(HEADER,
            "HCP1,2024-04-15,EV1,,Attended,P1,I1",
            "HCP2,2024-04-15,EV2,  ,Attended,P1,I1",
            "HCP3,2024-04-15,EV3,EVENT,Attended,P1,I1"
        ), filters(7, REFERENCE_DATE));

        assertEquals(List.of("EV3"), mapped.stream().map(CanonicalEngagement::id).toList());
    }

    @Test
    void testMap_missingDateColumn() {
        SchemaMappingException e = assertThrows(SchemaMappingException.class, () -> mapper.map(
            table("customer_id,conference_id,channel,action", "HCP1,EV1,EVENT,Attended"),
            filters(7, REFERENCE_DATE)));

        assertThat(e.getMessage(), containsString("ACTVY_STRT_DT"));
    }
}
