package org.hcpdata.extractor.engagement.model;

import java.util.List;
import java.util.Objects;

/**
 * Read-only filters applied to one source.
 *
 * @param predicates exact-match predicates, all of which a row must satisfy
 * @param retention  the source's retention window
 */
public record SourceFilterConfig(List<FieldPredicate> predicates, RetentionWindowConfig retention) {

    public SourceFilterConfig {
        predicates = List.copyOf(predicates);
        Objects.requireNonNull(retention, "retention");
    }

    public boolean matches(RawRecord record) {
        return predicates.stream().allMatch(predicate -> predicate.test(record));
    }

    public List<String> filteredFields() {
        return predicates.stream().map(FieldPredicate::field).toList();
    }
}
