package org.hcpdata.extractor.engagement.model;

import java.util.Collection;
import java.util.List;

/**
 * A full in-memory snapshot of one source.
 *
 * @param columns header columns, in file order
 * @param rows    data rows, in file order
 */
public record RawTable(List<String> columns, List<RawRecord> rows) {

    public RawTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * Fields from the given collection that the header does not contain.
     *
     * @param fields field names to check
     * @return the missing field names, in the order given
     */
    public List<String> missingColumns(Collection<String> fields) {
        return fields.stream()
            .filter(field -> !columns.contains(field))
            .distinct()
            .toList();
    }
}
