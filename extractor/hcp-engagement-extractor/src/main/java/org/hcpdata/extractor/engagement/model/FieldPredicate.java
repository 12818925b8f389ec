package org.hcpdata.extractor.engagement.model;

import java.util.Objects;

/**
 * Exact-match filter on one raw field.
 *
 * @param field         raw column name
 * @param expectedValue value the trimmed cell must equal
 */
public record FieldPredicate(String field, String expectedValue) {

    public FieldPredicate {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(expectedValue, "expectedValue");
    }

    public boolean test(RawRecord record) {
        return expectedValue.equals(record.get(field));
    }
}
