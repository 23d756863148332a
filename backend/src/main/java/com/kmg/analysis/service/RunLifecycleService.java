package com.kmg.analysis.service;

import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.model.RunStatus;
import com.kmg.analysis.repo.RunItemRepository;
import com.kmg.analysis.repo.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

@Service
public class RunLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(RunLifecycleService.class);

    static final String CANCELLED_CODE = "CANCELLED";
    static final String RUN_FAILED_CODE = "RUN_FAILED";

    private final RunRepository runRepository;
    private final RunItemRepository runItemRepository;
    private final TransactionTemplate transactionTemplate;
    private final TimeService timeService;
    private final AnalysisProperties properties;

    public RunLifecycleService(
            RunRepository runRepository,
            RunItemRepository runItemRepository,
            TransactionTemplate transactionTemplate,
            TimeService timeService,
            AnalysisProperties properties
    ) {
        this.runRepository = runRepository;
        this.runItemRepository = runItemRepository;
        this.transactionTemplate = transactionTemplate;
        this.timeService = timeService;
        this.properties = properties;
    }

    public void heartbeat(long runId) {
        runRepository.heartbeat(runId, timeService.now());
    }

    /**
     * Closes a running run whose items are all terminal. Returns the new status, or null if the run
     * still has queued or processing items.
     */
    public RunStatus finishIfDrained(long runId) {
        Instant now = timeService.now();
        boolean finished = runRepository.finishIfDrained(runId, properties.getWorker().getFailureRatioThreshold(), now);
        if (!finished) {
            return null;
        }
        RunStatus status = runRepository.findStatus(runId).orElse(null);
        if (status == RunStatus.FAILED) {
            log.warn("Run {} finished as FAILED: failure ratio exceeded {}",
                    runId, properties.getWorker().getFailureRatioThreshold());
        } else {
            log.info("Run {} finished as {}", runId, status);
        }
        return status;
    }

    public boolean failRun(long runId, String reason) {
        Boolean halted = transactionTemplate.execute(status -> {
            Instant now = timeService.now();
            if (!runRepository.halt(runId, RunStatus.FAILED, reason, now)) {
                return false;
            }
            int skipped = runItemRepository.skipQueued(runId, RUN_FAILED_CODE, now);
            log.error("Run {} failed: {} ({} queued item(s) skipped)", runId, reason, skipped);
            return true;
        });
        return Boolean.TRUE.equals(halted);
    }

    public int cancel(long runId) {
        Integer skipped = transactionTemplate.execute(status -> {
            Instant now = timeService.now();
            if (!runRepository.halt(runId, RunStatus.CANCELLED, "Cancelled by operator", now)) {
                RunStatus current = runRepository.findStatus(runId)
                        .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
                throw new IllegalStateException("Run " + runId + " is already " + current);
            }
            return runItemRepository.skipQueued(runId, CANCELLED_CODE, now);
        });
        int count = skipped == null ? 0 : skipped;
        log.info("Run {} cancelled ({} queued item(s) skipped)", runId, count);
        return count;
    }
}
