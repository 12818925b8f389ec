package org.hcpdata.extractor.engagement.pipeline;

import static org.hcpdata.extractor.engagement.util.Constants.UNIFIED_OUTPUT_FILENAME;

import java.io.IOException;
import java.net.URI;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.hcpdata.extractor.engagement.config.EngagementProperties;
import org.hcpdata.extractor.engagement.csv.EngagementCsvWriter;
import org.hcpdata.extractor.engagement.csv.RawTableReader;
import org.hcpdata.extractor.engagement.exception.EngagementPipelineException;
import org.hcpdata.extractor.engagement.exception.InvalidConfigurationException;
import org.hcpdata.extractor.engagement.exception.SourceUnavailableException;
import org.hcpdata.extractor.engagement.model.CanonicalEngagement;
import org.hcpdata.extractor.engagement.model.ParsedSourceConfig;
import org.hcpdata.extractor.engagement.model.RawTable;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.hcpdata.extractor.engagement.model.UnifiedDataset;
import org.hcpdata.extractor.engagement.util.DefaultArgs;
import org.hcpdata.extractor.engagement.util.FileHandler;
import org.hcpdata.extractor.engagement.util.SourceConfigParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs every source in {@link SourceType} order, writes each source's output, then writes the unified dataset.
 * The first source that fails stops the run; later sources are not attempted and nothing is consolidated.
 */
@Component
public class EngagementRunOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EngagementRunOrchestrator.class);

    private final EngagementProperties properties;
    private final FileHandler fileHandler;
    private final RawTableReader rawTableReader;
    private final EngagementCsvWriter csvWriter;
    private final PipelineRunner pipelineRunner;
    private final Consolidator consolidator;
    private final Clock clock;

    public EngagementRunOrchestrator(
        EngagementProperties properties,
        FileHandler fileHandler,
        RawTableReader rawTableReader,
        EngagementCsvWriter csvWriter,
        PipelineRunner pipelineRunner,
        Consolidator consolidator,
        Clock clock
    ) {
        this.properties = properties;
        this.fileHandler = fileHandler;
        this.rawTableReader = rawTableReader;
        this.csvWriter = csvWriter;
        this.pipelineRunner = pipelineRunner;
        this.consolidator = consolidator;
        this.clock = clock;
    }

    /**
     * Runs all sources and consolidates them.
     *
     * @return The unified dataset, also written to the unified output location.
     * @throws EngagementPipelineException On the first source failure, or if the outputs cannot be prepared or written.
     */
    public UnifiedDataset runAll() throws EngagementPipelineException {
        String outputDir = DefaultArgs.getOutputDir(properties.getOutputDir());
        try (RunContext context = RunContext.start(clock, Path.of(outputDir))) {
            try {
                context.resetOutputDirectory();
            } catch (IOException e) {
                throw new EngagementPipelineException("Could not reset output directory " + outputDir, e);
            }
            logger.info("Starting pipeline execution");

            Map<SourceType, List<CanonicalEngagement>> resultsBySource = new EnumMap<>(SourceType.class);
            for (SourceType source : SourceType.values()) {
                resultsBySource.put(source, runSource(source, context, outputDir));
            }

            UnifiedDataset unified = consolidator.consolidate(resultsBySource);
            String unifiedOutput = StringUtils.isBlank(properties.getUnifiedOutput())
                ? outputDir + "/" + UNIFIED_OUTPUT_FILENAME
                : properties.getUnifiedOutput();
            write(null, unified.records(), unifiedOutput);
            logger.info("Saved {} consolidated HCP records to {}", unified.size(), unifiedOutput);
            return unified;
        }
    }

    /**
     * Runs a single source and writes its output.
     *
     * @param source  The source to run.
     * @param context The current run.
     * @param outputDir Directory for outputs without an explicit location.
     * @return The source's canonical engagements.
     * @throws EngagementPipelineException If the source cannot be configured, read, mapped or written.
     */
    List<CanonicalEngagement> runSource(SourceType source, RunContext context, String outputDir) throws EngagementPipelineException {
        String name = source.getConfigKey();
        try {
            ParsedSourceConfig config = SourceConfigParser.parse(source, properties.getSources().get(name), outputDir, context.referenceDate());
            logger.info("Running {} pipeline with source {}", name, config.sourcePath());

            RawTable table = readSource(source, config.sourcePath());
            List<CanonicalEngagement> result = pipelineRunner.run(source, table, config.filterConfig());

            write(source, result, config.outputPath());
            logger.info("Saved {} output to {}", name, config.outputPath());
            logger.info("Completed {} pipeline", name);
            return result;
        } catch (EngagementPipelineException e) {
            // Cause only, the stack trace stays out of the run log
            logger.error("Failed to run {} pipeline: {}: {}", name, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private RawTable readSource(SourceType source, String location) throws EngagementPipelineException {
        URI uri = toUri(source, location);
        byte[] data;
        try {
            data = fileHandler.read(uri);
        } catch (NoSuchFileException e) {
            throw new SourceUnavailableException(source, "Input file missing: " + location, e);
        } catch (IOException e) {
            throw new SourceUnavailableException(source, "Could not read " + location + ": " + e.getMessage(), e);
        }
        try {
            return rawTableReader.read(data);
        } catch (IOException e) {
            throw new SourceUnavailableException(source, "Could not parse " + location + " as CSV: " + e.getMessage(), e);
        }
    }

    private void write(SourceType source, List<CanonicalEngagement> records, String location) throws EngagementPipelineException {
        try {
            fileHandler.put(csvWriter.write(records), toUri(source, location));
        } catch (IOException e) {
            throw new EngagementPipelineException(source, "Could not write " + location + ": " + e.getMessage(), e);
        }
    }

    private static URI toUri(SourceType source, String location) throws InvalidConfigurationException {
        try {
            return FileHandler.toUri(location);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(source, "Invalid location " + location + ": " + e.getMessage());
        }
    }
}
