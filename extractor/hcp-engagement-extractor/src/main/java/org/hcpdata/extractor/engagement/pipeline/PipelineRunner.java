package org.hcpdata.extractor.engagement.pipeline;

import static org.hcpdata.extractor.engagement.util.Constants.RECORD_COUNTER;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.List;
import java.util.stream.Stream;
import org.hcpdata.extractor.engagement.exception.SchemaMappingException;
import org.hcpdata.extractor.engagement.mapper.SchemaMapper;
import org.hcpdata.extractor.engagement.mapper.SchemaMapperRegistry;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.hcpdata.extractor.engagement.model.RecordStatus;
import org.hcpdata.extractor.engagement.model.RetentionWindowConfig;
import org.hcpdata.extractor.engagement.model.SourceFilterConfig;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes one source: schema mapping, then the retention window, then the source's own refinement.
 */
@Component
public class PipelineRunner {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    private final SchemaMapperRegistry schemaMapperRegistry;
    private final MeterRegistry meterRegistry;

    /**
     * Constructor for PipelineRunner.
     *
     * @param schemaMapperRegistry The registry supplying each source's mapper.
     * @param meterRegistry        The meter registry for record counts.
     */
    public PipelineRunner(SchemaMapperRegistry schemaMapperRegistry, MeterRegistry meterRegistry) {
        this.schemaMapperRegistry = schemaMapperRegistry;
        this.meterRegistry = meterRegistry;

        // https://prometheus.io/docs/practices/instrumentation/#avoid-missing-metrics
        Stream.of(SourceType.values()).forEach(source ->
            Stream.of(RecordStatus.values()).forEach(status -> count(source, status, 0)));
    }

    /**
     * Runs one source.
     *
     * @param source       The source being run.
     * @param table        The source's raw snapshot.
     * @param filterConfig The source's filters and retention window.
     * @return Canonical engagements in mapped order.
     * @throws SchemaMappingException If the table lacks a field the source needs.
     */
    public List<CanonicalEngagement> run(SourceType source, RawTable table, SourceFilterConfig filterConfig)
        throws SchemaMappingException {
        SchemaMapper mapper = schemaMapperRegistry.forSource(source);
        count(source, RecordStatus.READ, table.rows().size());

        List<CanonicalEngagement> mapped = mapper.map(table, filterConfig);
        count(source, RecordStatus.MAPPED, mapped.size());

        RetentionWindowConfig retention = filterConfig.retention();
        List<CanonicalEngagement> retained = mapped.stream()
            .filter(engagement -> retention.retains(engagement.activityDate()))
            .toList();
        count(source, RecordStatus.EXPIRED, mapped.size() - retained.size());

        List<CanonicalEngagement> result = mapper.refineRetained(retained);
        count(source, RecordStatus.REFINED_OUT, retained.size() - result.size());
        count(source, RecordStatus.RETAINED, result.size());

        logger.info("{} - Read {} rows, mapped {}, kept {} dated on or after {} ({} months before {})",
            source.getConfigKey(), table.rows().size(), mapped.size(), result.size(),
            retention.cutoff(), retention.monthsToRetain(), retention.referenceDate());
        return result;
    }

    private void count(SourceType source, RecordStatus status, int amount) {
        meterRegistry.counter(RECORD_COUNTER, Tags.of("source", source.getConfigKey(), "status", status.getStatus()))
            .increment(amount);
    }
}
