package com.kmg.analysis.config;

import com.kmg.analysis.repo.SchemaInitializer;
import com.kmg.analysis.service.StaleItemReclaimer;
import com.kmg.analysis.service.WorkerRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final AnalysisProperties properties;
    private final SchemaInitializer schemaInitializer;
    private final StaleItemReclaimer staleItemReclaimer;
    private final WorkerRunner workerRunner;

    public StartupInitializer(
            AnalysisProperties properties,
            SchemaInitializer schemaInitializer,
            StaleItemReclaimer staleItemReclaimer,
            WorkerRunner workerRunner
    ) {
        this.properties = properties;
        this.schemaInitializer = schemaInitializer;
        this.staleItemReclaimer = staleItemReclaimer;
        this.workerRunner = workerRunner;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        schemaInitializer.initialize();

        if (properties.getWorker().isResetStaleOnStart()) {
            StaleItemReclaimer.SweepResult result = staleItemReclaimer.sweep();
            log.info("Startup sweep reclaimed {} stale item(s)", result.reclaimedItems());
        }

        if (properties.getWorker().isEnabled()) {
            workerRunner.start();
        } else {
            log.info("Analysis workers are disabled (analysis.worker.enabled=false)");
        }
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }
}
