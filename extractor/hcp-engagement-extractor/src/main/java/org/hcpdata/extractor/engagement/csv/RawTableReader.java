package org.hcpdata.extractor.engagement.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.hcpdata.extractor.engagement.model.RawRecord;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.springframework.stereotype.Component;

/**
 * Reads a CSV export with a header line into a {@link RawTable}. All cells are read as strings.
 */
@Component
public class RawTableReader {

    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .enable(CsvParser.Feature.TRIM_SPACES)
        .build();

    /**
     * Parses CSV bytes.
     *
     * @param data UTF-8 CSV content, header first
     * @return the table; a file holding only a header yields a table with columns and no rows
     * @throws IOException if the content is not valid CSV
     */
    public RawTable read(byte[] data) throws IOException {
        List<RawRecord> rows = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        try (MappingIterator<Map<String, String>> iterator = csvMapper
            .readerForMapOf(String.class)
            .with(HEADER_SCHEMA)
            .readValues(data)) {
            while (iterator.hasNextValue()) {
                rows.add(new RawRecord(iterator.nextValue()));
            }
            if (iterator.getParserSchema() instanceof CsvSchema schema) {
                schema.forEach(column -> columns.add(column.getName()));
            }
        }
        return new RawTable(columns, rows);
    }
}
