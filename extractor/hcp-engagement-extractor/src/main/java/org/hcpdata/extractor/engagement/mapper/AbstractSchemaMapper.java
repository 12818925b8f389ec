package org.hcpdata.extractor.engagement.mapper;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.hcpdata.extractor.engagement.exception.DateFormatException;
import org.hcpdata.extractor.engagement.exception.SchemaMappingException;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawRecord;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.hcpdata.extractor.engagement.model.SourceFilterConfig;
import org.hcpdata.extractor.engagement.util.DateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared mapping steps: header validation, exact-match filtering, date parsing and row-level drops.
 * Subclasses name their raw fields and build the canonical record from a row.
 */
public abstract class AbstractSchemaMapper implements SchemaMapper {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    protected abstract String hcpIdField();

    protected abstract String dateField();

    protected abstract String idField();

    /**
     * Raw fields needed beyond the HCP, date and id fields.
     */
    protected abstract List<String> additionalFields();

    /**
     * Builds the canonical record for a row that passed filtering and date parsing.
     *
     * @param record       the raw row
     * @param activityDate the parsed activity date
     * @return the mapped engagement
     */
    protected abstract CanonicalEngagement toEngagement(RawRecord record, LocalDate activityDate);

    /**
     * Source-specific row check applied after the configured filters.
     */
    protected boolean accept(RawRecord record) {
        return true;
    }

    /**
     * Source-specific pass over all mapped records, e.g. ordering or aggregation.
     */
    protected List<CanonicalEngagement> postProcess(List<CanonicalEngagement> mapped) {
        return mapped;
    }

    @Override
    public List<CanonicalEngagement> map(RawTable table, SourceFilterConfig filterConfig) throws SchemaMappingException {
        validateColumns(table, filterConfig);

        List<CanonicalEngagement> mapped = new ArrayList<>();
        int filtered = 0;
        int rejected = 0;
        int rowNumber = 0;
        for (RawRecord record : table.rows()) {
            rowNumber++;
            if (!filterConfig.matches(record) || !accept(record)) {
                filtered++;
                continue;
            }
            if (record.get(hcpIdField()).isEmpty()) {
                logger.warn("{} - Dropping row {}: blank {}", sourceType().getConfigKey(), rowNumber, hcpIdField());
                rejected++;
                continue;
            }
            LocalDate activityDate;
            try {
                activityDate = DateEngine.parseDate(record.get(dateField()));
            } catch (DateFormatException e) {
                logger.warn("{} - Dropping row {}: {} in {}", sourceType().getConfigKey(), rowNumber, e.getMessage(), dateField());
                rejected++;
                continue;
            }
            mapped.add(toEngagement(record, activityDate));
        }

        logger.info("{} - Mapped {} of {} rows ({} filtered out, {} rejected)",
            sourceType().getConfigKey(), mapped.size(), table.rows().size(), filtered, rejected);
        return postProcess(mapped);
    }

    private void validateColumns(RawTable table, SourceFilterConfig filterConfig) throws SchemaMappingException {
        List<String> required = Stream.of(
                Stream.of(hcpIdField(), dateField(), idField()),
                additionalFields().stream(),
                filterConfig.filteredFields().stream())
            .flatMap(s -> s)
            .toList();
        List<String> missing = table.missingColumns(required);
        if (!missing.isEmpty()) {
            throw new SchemaMappingException(sourceType(),
                "Source " + sourceType().getConfigKey() + " is missing required fields " + String.join(", ", missing));
        }
    }
}
