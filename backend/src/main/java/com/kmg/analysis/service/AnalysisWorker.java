package com.kmg.analysis.service;

import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.model.FailureKind;
import com.kmg.analysis.model.RunItemRecord;
import com.kmg.analysis.model.RunRecord;
import com.kmg.analysis.model.RunStatus;
import com.kmg.analysis.repo.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class AnalysisWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(AnalysisWorker.class);

    private final String workerId;
    private final RunRepository runRepository;
    private final ClaimService claimService;
    private final ItemProcessor itemProcessor;
    private final RunLifecycleService runLifecycleService;
    private final WorkerTelemetry telemetry;
    private final TimeService timeService;
    private final AnalysisProperties.Worker settings;

    private volatile boolean stopRequested;

    public AnalysisWorker(
            String workerId,
            RunRepository runRepository,
            ClaimService claimService,
            ItemProcessor itemProcessor,
            RunLifecycleService runLifecycleService,
            WorkerTelemetry telemetry,
            TimeService timeService,
            AnalysisProperties properties
    ) {
        this.workerId = workerId;
        this.runRepository = runRepository;
        this.claimService = claimService;
        this.itemProcessor = itemProcessor;
        this.runLifecycleService = runLifecycleService;
        this.telemetry = telemetry;
        this.timeService = timeService;
        this.settings = properties.getWorker();
    }

    @Override
    public void run() {
        log.info("Worker {} started (chunk size {}, idle sleep {} ms)",
                workerId, settings.getChunkSize(), settings.getSleepInterval().toMillis());
        int consecutiveErrors = 0;
        while (!stopRequested) {
            try {
                CycleReport report = runCycle();
                consecutiveErrors = 0;
                if (report.idle() && !stopRequested) {
                    Thread.sleep(settings.getSleepInterval().toMillis());
                }
            } catch (DataAccessException e) {
                consecutiveErrors++;
                telemetry.recordCycleError();
                long backoff = errorBackoffMillis(consecutiveErrors);
                log.error("Worker {} cycle failed ({} in a row), retrying in {} ms", workerId, consecutiveErrors, backoff, e);
                if (!sleepQuietly(backoff)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                consecutiveErrors++;
                telemetry.recordCycleError();
                log.error("Worker {} hit an unexpected error", workerId, e);
                if (!sleepQuietly(errorBackoffMillis(consecutiveErrors))) {
                    break;
                }
            }
        }
        log.info("Worker {} stopped", workerId);
    }

    public CycleReport runCycle() throws InterruptedException {
        Instant startedAt = timeService.now();
        CycleCounts counts = new CycleCounts();

        List<RunRecord> runs = runRepository.findActiveRuns(settings.getMaxRunsPerCycle());
        Long oldestHeartbeatAge = null;
        for (RunRecord run : runs) {
            Instant beat = run.heartbeatAt() != null ? run.heartbeatAt() : run.createdAt();
            long age = Math.max(0, Duration.between(beat, startedAt).toMillis());
            oldestHeartbeatAge = oldestHeartbeatAge == null ? age : Math.max(oldestHeartbeatAge, age);
        }

        for (RunRecord run : runs) {
            if (stopRequested) {
                break;
            }
            List<RunItemRecord> items = claimService.claim(run.id(), settings.getChunkSize(), workerId);
            if (!items.isEmpty()) {
                counts.claimed += items.size();
                processBatch(run, items, counts);
                runLifecycleService.heartbeat(run.id());
            }
            runLifecycleService.finishIfDrained(run.id());
        }

        CycleReport report = new CycleReport(
                workerId,
                startedAt,
                Duration.between(startedAt, timeService.now()).toMillis(),
                runs.size(),
                counts.claimed,
                counts.completed,
                counts.completedWithFallback,
                counts.deferred,
                counts.failed,
                counts.released,
                counts.claimsLost,
                counts.costUsd,
                oldestHeartbeatAge
        );
        telemetry.record(report);
        if (report.idle()) {
            log.debug("Worker {} idle: {} active run(s), nothing claimable", workerId, runs.size());
        } else {
            log.info("Worker {} cycle: claimed={} completed={} fallback={} deferred={} failed={} cost=${}",
                    workerId, report.claimed(), report.completed(), report.completedWithFallback(),
                    report.deferred(), report.failed(), String.format("%.6f", report.costUsd()));
        }
        return report;
    }

    private void processBatch(RunRecord run, List<RunItemRecord> items, CycleCounts counts) throws InterruptedException {
        boolean runHalted = false;
        for (int i = 0; i < items.size(); i++) {
            RunItemRecord item = items.get(i);
            if (runHalted) {
                count(counts, itemProcessor.failHalted(item, FailureKind.AUTH_ERROR, "Run halted after authorization failure"));
                continue;
            }
            if (stopRequested) {
                releaseRemaining(items.subList(i, items.size()), counts);
                return;
            }
            RunStatus status = runRepository.findStatus(run.id()).orElse(null);
            if (status == null || !status.isActive()) {
                log.info("Run {} is {}; releasing {} unprocessed item(s)", run.id(), status, items.size() - i);
                releaseRemaining(items.subList(i, items.size()), counts);
                return;
            }

            ItemProcessor.Result result;
            try {
                result = itemProcessor.process(run, item);
            } catch (InterruptedException e) {
                releaseRemaining(items.subList(i, items.size()), counts);
                throw e;
            } catch (DataAccessException e) {
                releaseRemaining(items.subList(i, items.size()), counts);
                throw e;
            } catch (RuntimeException e) {
                log.error("Worker {} could not process item {}", workerId, item.id(), e);
                count(counts, itemProcessor.failUnexpected(item, e));
                continue;
            }

            count(counts, result);
            if (result.outcome() == ItemProcessor.Outcome.RUN_HALTED) {
                runHalted = true;
            }
        }
    }

    private void releaseRemaining(List<RunItemRecord> remaining, CycleCounts counts) {
        for (RunItemRecord item : remaining) {
            try {
                if (itemProcessor.release(item)) {
                    counts.released++;
                }
            } catch (DataAccessException e) {
                log.warn("Worker {} could not release item {}; stale sweep will reclaim it: {}",
                        workerId, item.id(), e.getMessage());
            }
        }
    }

    private void count(CycleCounts counts, ItemProcessor.Result result) {
        counts.costUsd += result.costUsd();
        switch (result.outcome()) {
            case COMPLETED -> counts.completed++;
            case COMPLETED_FALLBACK -> {
                counts.completed++;
                counts.completedWithFallback++;
            }
            case DEFERRED -> counts.deferred++;
            case FAILED, RUN_HALTED -> counts.failed++;
            case CLAIM_LOST -> counts.claimsLost++;
        }
    }

    private long errorBackoffMillis(int consecutiveErrors) {
        long base = settings.getSleepInterval().toMillis();
        int shift = Math.min(consecutiveErrors - 1, 6);
        return Math.min(base * (1L << shift), Duration.ofMinutes(5).toMillis());
    }

    private boolean sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void requestStop() {
        stopRequested = true;
    }

    private static class CycleCounts {
        int claimed;
        int completed;
        int completedWithFallback;
        int deferred;
        int failed;
        int released;
        int claimsLost;
        double costUsd;
    }
}
