package org.hcpdata.extractor.engagement.model;

/**
 * Configuration of one source resolved against defaults and validated.
 *
 * @param source       the source
 * @param sourcePath   location of the raw table, a local path or an {@code s3://} URI
 * @param outputPath   location for the source's canonical output
 * @param filterConfig filters and retention window to apply
 */
public record ParsedSourceConfig(
    SourceType source,
    String sourcePath,
    String outputPath,
    SourceFilterConfig filterConfig
) {}
