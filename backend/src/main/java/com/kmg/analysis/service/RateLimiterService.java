package com.kmg.analysis.service;

import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.repo.RunThrottleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

// An idle run restarts its schedule from the current time, so no burst of catch-up requests is released.
@Service
public class RateLimiterService {
    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final RunThrottleRepository throttleRepository;
    private final TimeService timeService;
    private final AnalysisProperties properties;

    public RateLimiterService(
            RunThrottleRepository throttleRepository,
            TimeService timeService,
            AnalysisProperties properties
    ) {
        this.throttleRepository = throttleRepository;
        this.timeService = timeService;
        this.properties = properties;
    }

    public long acquire(long runId, Double ratePerSecond) throws InterruptedException {
        long interval = intervalMillis(ratePerSecond);
        long slot;
        while (true) {
            long next = throttleRepository.readNextSlot(runId);
            slot = Math.max(next, timeService.millis());
            if (throttleRepository.compareAndSetNextSlot(runId, next, slot + interval)) {
                break;
            }
        }

        long wait;
        while ((wait = slot - timeService.millis()) > 0) {
            Thread.sleep(wait);
        }
        return slot;
    }

    long intervalMillis(Double ratePerSecond) {
        double rate = effectiveRate(ratePerSecond);
        long fromRate = (long) Math.ceil(1000.0 / rate);
        return Math.max(fromRate, properties.getWorker().getMinRequestInterval().toMillis());
    }

    double effectiveRate(Double ratePerSecond) {
        if (ratePerSecond == null || ratePerSecond.isNaN() || ratePerSecond.isInfinite() || ratePerSecond <= 0) {
            double fallback = properties.getClassifier().getDefaultRatePerSecond();
            if (ratePerSecond != null) {
                log.warn("Invalid rate {} per second, using default {}", ratePerSecond, fallback);
            }
            return fallback;
        }
        return ratePerSecond;
    }
}
