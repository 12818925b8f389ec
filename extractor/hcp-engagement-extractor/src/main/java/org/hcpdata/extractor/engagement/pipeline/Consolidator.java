package org.hcpdata.extractor.engagement.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.hcpdata.extractor.engagement.exception.IncompleteSourceException;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.hcpdata.extractor.engagement.model.UnifiedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Concatenates per-source results into the unified dataset, in {@link SourceType} order.
 * Nothing is reordered, removed or merged.
 */
@Component
public class Consolidator {

    private static final Logger logger = LoggerFactory.getLogger(Consolidator.class);

    /**
     * Consolidates the results of every source.
     *
     * @param resultsBySource Records produced by each source. A source that ran and kept nothing maps to an empty list.
     * @return The unified dataset.
     * @throws IncompleteSourceException If any source has no entry.
     */
    public UnifiedDataset consolidate(Map<SourceType, List<CanonicalEngagement>> resultsBySource)
        throws IncompleteSourceException {
        List<SourceType> missing = Arrays.stream(SourceType.values())
            .filter(source -> resultsBySource.get(source) == null)
            .toList();
        if (!missing.isEmpty()) {
            throw new IncompleteSourceException(missing);
        }

        List<CanonicalEngagement> records = new ArrayList<>();
        for (SourceType source : SourceType.values()) {
            records.addAll(resultsBySource.get(source));
        }
        logger.info("Consolidated {} records from {} sources", records.size(), SourceType.values().length);
        return new UnifiedDataset(records);
    }
}
