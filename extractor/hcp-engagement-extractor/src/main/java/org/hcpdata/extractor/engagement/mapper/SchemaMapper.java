package org.hcpdata.extractor.engagement.mapper;

import java.util.List;
import org.hcpdata.extractor.engagement.exception.SchemaMappingException;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.hcpdata.extractor.engagement.model.SourceFilterConfig;
import org.hcpdata.extractor.engagement.model.SourceType;

/**
 * Maps one source's raw table into canonical engagements.
 */
public interface SchemaMapper {

    /**
     * The source this mapper handles.
     *
     * @return the source type
     */
    SourceType sourceType();

    /**
     * Maps a raw table, dropping rows that fail the exact-match filters or carry an unparseable date.
     * The retention window is not applied here.
     *
     * @param table        the source snapshot
     * @param filterConfig the source's filters
     * @return the mapped engagements
     * @throws SchemaMappingException if the table lacks a required or filtered field
     */
    List<CanonicalEngagement> map(RawTable table, SourceFilterConfig filterConfig) throws SchemaMappingException;

    /**
     * Source-specific pass over the records that survived the retention window.
     *
     * @param retained records inside the retention window, in mapped order
     * @return the records to output
     */
    default List<CanonicalEngagement> refineRetained(List<CanonicalEngagement> retained) {
        return retained;
    }
}
