package org.hcpdata.extractor.engagement.pipeline;

import static org.hcpdata.extractor.engagement.util.Constants.PIPELINE_LOG_FILENAME;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one run, created once at the start and closed at the end: the reference date that anchors every
 * retention window and the local output directory, which also holds the run log.
 */
public final class RunContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RunContext.class);

    private final Clock clock;
    private final Instant startedAt;
    private final LocalDate referenceDate;
    private final Path outputDirectory;

    private RunContext(Clock clock, Path outputDirectory) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.referenceDate = LocalDate.ofInstant(startedAt, clock.getZone());
        this.outputDirectory = outputDirectory;
    }

    /**
     * Starts a run now.
     *
     * @param clock           Clock fixing the run start.
     * @param outputDirectory Local directory receiving outputs.
     * @return The context of the new run.
     */
    public static RunContext start(Clock clock, Path outputDirectory) {
        RunContext context = new RunContext(clock, outputDirectory);
        logger.info("Run started at {} with reference date {}", context.startedAt, context.referenceDate);
        return context;
    }

    /**
     * Deletes the files a previous run left in the output directory, keeping the run log, or creates the directory.
     *
     * @throws IOException If the directory cannot be listed, created or cleaned.
     */
    public void resetOutputDirectory() throws IOException {
        if (!Files.isDirectory(outputDirectory)) {
            Files.createDirectories(outputDirectory);
            return;
        }
        List<Path> stale;
        try (Stream<Path> files = Files.list(outputDirectory)) {
            stale = files
                .filter(Files::isRegularFile)
                .filter(file -> !PIPELINE_LOG_FILENAME.equals(file.getFileName().toString()))
                .toList();
        }
        for (Path file : stale) {
            Files.delete(file);
        }
        logger.info("Removed {} files from output directory {}", stale.size(), outputDirectory);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public LocalDate referenceDate() {
        return referenceDate;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path logFile() {
        return outputDirectory.resolve(PIPELINE_LOG_FILENAME);
    }

    @Override
    public void close() {
        logger.info("Run started at {} finished after {} ms", startedAt, Duration.between(startedAt, clock.instant()).toMillis());
    }
}
