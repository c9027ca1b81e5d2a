package com.delta.creatoringest.ingest.service;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.model.IngestRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class IngestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestCliRunner.class);

    private final IngestProperties properties;
    private final IngestRunService ingestRunService;
    private final ConfigurableApplicationContext applicationContext;

    public IngestCliRunner(
        IngestProperties properties,
        IngestRunService ingestRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.ingestRunService = ingestRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        IngestRunSummary summary = ingestRunService.run();
        log.info(
            "Ingest run {} completed with status {}: resumed at {}, checkpoint {}, tasks {}/{}, records {}",
            summary.runId(),
            summary.status(),
            summary.resumedFrom(),
            summary.checkpoint(),
            summary.tasksCompleted(),
            summary.totalTasks(),
            summary.recordsPersisted()
        );
        summary.outcomes().forEach((outcome, count) -> log.info("Outcome {}: {}", outcome, count));

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, summary::exitCode);
            System.exit(exitCode);
        }
    }
}
