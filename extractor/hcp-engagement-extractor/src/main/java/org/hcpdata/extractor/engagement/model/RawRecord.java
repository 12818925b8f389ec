package org.hcpdata.extractor.engagement.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * One row of a source table, keyed by the source's own column names.
 *
 * @param fields column name to raw cell value
 */
public record RawRecord(Map<String, String> fields) {

    public RawRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Trimmed value of a field. Missing fields and empty cells both read as the empty string.
     *
     * @param field column name
     * @return the trimmed value, never null
     */
    public String get(String field) {
        return StringUtils.trimToEmpty(fields.get(field));
    }
}
