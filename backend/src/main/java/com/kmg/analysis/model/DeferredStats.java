package com.kmg.analysis.model;

import java.time.Instant;
import java.util.Map;

public record DeferredStats(
        long deferredTotal,
        long readyNow,
        long waiting,
        Instant nextAvailableAt,
        int maxAttemptCount,
        Map<String, Long> byErrorCode
) {
}
