package org.hcpdata.extractor.engagement.pipeline;

import org.hcpdata.extractor.engagement.exception.EngagementPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the extraction once when the application starts. A failed run sets a non-zero exit code.
 */
@Component
@ConditionalOnProperty(prefix = "hcp", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class EngagementExtractorRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(EngagementExtractorRunner.class);

    private final EngagementRunOrchestrator orchestrator;
    private int exitCode = 0;

    public EngagementExtractorRunner(EngagementRunOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) {
        try {
            orchestrator.runAll();
        } catch (EngagementPipelineException e) {
            logger.error("Pipeline execution failed: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
