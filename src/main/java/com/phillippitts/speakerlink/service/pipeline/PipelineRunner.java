package com.phillippitts.speakerlink.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once the context is up, when {@code speakerlink.pipeline.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "speakerlink.pipeline", name = "run-on-startup", havingValue = "true")
public class PipelineRunner implements ApplicationRunner {
    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    private final PipelineOrchestrator orchestrator;

    public PipelineRunner(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOG.info("Running pipeline on startup");
        PipelineReport report = orchestrator.run();
        LOG.info("Startup run {} produced {} profiles", report.runId(), report.profileCount());
    }
}
