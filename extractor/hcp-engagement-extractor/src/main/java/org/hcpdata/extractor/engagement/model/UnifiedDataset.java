package org.hcpdata.extractor.engagement.model;

import java.util.List;

/**
 * Engagements from every source, concatenated in source order.
 *
 * @param records the consolidated records
 */
public record UnifiedDataset(List<CanonicalEngagement> records) {

    public UnifiedDataset {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
