package com.kmg.analysis.dto;

import java.util.Map;

public record DeferredStatsView(
        Long runId,
        long deferredTotal,
        long readyNow,
        long waiting,
        String nextAvailableAt,
        int maxAttemptCount,
        Map<String, Long> byErrorCode
) {
}
