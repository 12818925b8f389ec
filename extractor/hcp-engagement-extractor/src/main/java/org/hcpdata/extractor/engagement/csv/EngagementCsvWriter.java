package org.hcpdata.extractor.engagement.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.springframework.stereotype.Component;

/**
 * Serializes canonical engagements as CSV with the {@code HCP_ID,ACTIVITY_DATE,YRMO,ID,CHANNEL,ACTION} header.
 * The same records always produce the same bytes.
 */
@Component
public class EngagementCsvWriter {

    private static final CsvSchema ROW_SCHEMA = CsvSchema.emptySchema().withLineSeparator("\n");

    private final CsvMapper csvMapper = new CsvMapper();

    public byte[] write(List<CanonicalEngagement> records) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (SequenceWriter writer = csvMapper.writer(ROW_SCHEMA).writeValues(outputStream)) {
            writer.write(CanonicalEngagement.COLUMNS);
            for (CanonicalEngagement record : records) {
                writer.write(record.toRow());
            }
        }
        return outputStream.toByteArray();
    }
}
