package org.hcpdata.extractor.engagement.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.junit.jupiter.api.Test;

class RawTableReaderTest {

    private final RawTableReader reader = new RawTableReader();

    private RawTable read(String csv) throws IOException {
        return reader.read(csv.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testRead_headerAndRows() throws IOException {
        RawTable table = read("""
            customer_id,activity_date,sevc_id,action
            HCP1, 2024-08-01 ,S1,Delivered

            HCP2,2024-08-02,"S2,a",Opened
            """);

        assertEquals(List.of("customer_id", "activity_date", "sevc_id", "action"), table.columns());
        assertEquals(2, table.rows().size());
        assertEquals("2024-08-01", table.rows().get(0).get("activity_date"));
        assertEquals("S2,a", table.rows().get(1).get("sevc_id"));
    }

    @Test
    void testRead_headerOnly() throws IOException {
        RawTable table = read("customer_id,activity_date,sevc_id,action\n");

        assertEquals(4, table.columns().size());
        assertTrue(table.rows().isEmpty());
        assertTrue(table.missingColumns(List.of("customer_id", "action")).isEmpty());
    }

    @Test
    void testRead_emptyCellsReadAsEmpty() throws IOException {
        RawTable table = read("customer_id,ACTVY_STRT_DT,conference_id,channel,action\nHCP1,2024-04-15,EV1,,Attended\n");

        assertEquals("", table.rows().get(0).get("channel"));
        assertEquals(List.of("product_id"), table.missingColumns(List.of("channel", "product_id", "product_id")));
    }
}
