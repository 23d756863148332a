package com.kmg.analysis.service;

import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.repo.RunItemRepository;
import com.kmg.analysis.repo.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class StaleItemReclaimer {
    private static final Logger log = LoggerFactory.getLogger(StaleItemReclaimer.class);

    public record SweepResult(int reclaimedItems, int flaggedRuns) {
    }

    private final RunItemRepository runItemRepository;
    private final RunRepository runRepository;
    private final TimeService timeService;
    private final AnalysisProperties properties;

    public StaleItemReclaimer(
            RunItemRepository runItemRepository,
            RunRepository runRepository,
            TimeService timeService,
            AnalysisProperties properties
    ) {
        this.runItemRepository = runItemRepository;
        this.runRepository = runRepository;
        this.timeService = timeService;
        this.properties = properties;
    }

    public SweepResult sweep() {
        return sweep(properties.getWorker().getStaleProcessingTimeout());
    }

    public SweepResult sweep(Duration processingTimeout) {
        Instant now = timeService.now();
        int reclaimed = runItemRepository.reclaimStale(now.minus(processingTimeout), now);
        if (reclaimed > 0) {
            log.warn("Reclaimed {} item(s) stuck in processing for more than {} s", reclaimed, processingTimeout.toSeconds());
        }

        Duration heartbeatTimeout = properties.getWorker().getRunHeartbeatTimeout();
        int flagged = runRepository.flagStaleRuns(now.minus(heartbeatTimeout), now);
        if (flagged > 0) {
            List<Long> runIds = runRepository.findFlaggedAt(now);
            log.warn("Run(s) {} have no heartbeat for more than {} s and need operator attention",
                    runIds, heartbeatTimeout.toSeconds());
        }
        return new SweepResult(reclaimed, flagged);
    }
}
