package com.kmg.analysis.service;

import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.repo.RunRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Component
public class WorkerRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkerRunner.class);

    private final RunRepository runRepository;
    private final ClaimService claimService;
    private final ItemProcessor itemProcessor;
    private final RunLifecycleService runLifecycleService;
    private final StaleItemReclaimer staleItemReclaimer;
    private final WorkerTelemetry telemetry;
    private final TimeService timeService;
    private final AnalysisProperties properties;

    private final List<AnalysisWorker> workers = new ArrayList<>();
    private ExecutorService workerExecutor;
    private ScheduledExecutorService sweepExecutor;

    public WorkerRunner(
            RunRepository runRepository,
            ClaimService claimService,
            ItemProcessor itemProcessor,
            RunLifecycleService runLifecycleService,
            StaleItemReclaimer staleItemReclaimer,
            WorkerTelemetry telemetry,
            TimeService timeService,
            AnalysisProperties properties
    ) {
        this.runRepository = runRepository;
        this.claimService = claimService;
        this.itemProcessor = itemProcessor;
        this.runLifecycleService = runLifecycleService;
        this.staleItemReclaimer = staleItemReclaimer;
        this.telemetry = telemetry;
        this.timeService = timeService;
        this.properties = properties;
    }

    public synchronized void start() {
        if (workerExecutor != null) {
            throw new IllegalStateException("Workers are already running.");
        }
        AnalysisProperties.Worker settings = properties.getWorker();
        String baseId = settings.getId() == null || settings.getId().isBlank() ? defaultWorkerId() : settings.getId();

        workerExecutor = Executors.newFixedThreadPool(settings.getConcurrency(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("analysis-worker-" + thread.getId());
            return thread;
        });
        for (int i = 1; i <= settings.getConcurrency(); i++) {
            AnalysisWorker worker = new AnalysisWorker(
                    baseId + "-" + i,
                    runRepository,
                    claimService,
                    itemProcessor,
                    runLifecycleService,
                    telemetry,
                    timeService,
                    properties
            );
            workers.add(worker);
            workerExecutor.submit(worker);
        }

        long sweepMillis = settings.getSweepInterval().toMillis();
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "analysis-stale-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        sweepExecutor.scheduleWithFixedDelay(this::sweepSafely, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        log.info("Started {} analysis worker(s) as {}", settings.getConcurrency(), baseId);
    }

    @PreDestroy
    public synchronized void stop() {
        if (workerExecutor == null) {
            return;
        }
        workers.forEach(AnalysisWorker::requestStop);
        sweepExecutor.shutdownNow();
        workerExecutor.shutdown();
        try {
            long timeout = properties.getWorker().getShutdownTimeout().toMillis();
            if (!workerExecutor.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {} ms, interrupting", timeout);
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            workers.clear();
            workerExecutor = null;
            sweepExecutor = null;
        }
    }

    private void sweepSafely() {
        try {
            staleItemReclaimer.sweep();
        } catch (RuntimeException e) {
            log.error("Stale sweep failed: {}", e.getMessage(), e);
        }
    }

    private String defaultWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "worker";
        }
        return host + ":" + ManagementFactory.getRuntimeMXBean().getPid();
    }
}
