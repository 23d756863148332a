package com.kmg.analysis.model;

import java.time.Instant;

public record RunRecord(
        long id,
        String scopeJson,
        String scopeHash,
        RunParams params,
        RunStatus status,
        String triggeredBy,
        String lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        Instant heartbeatAt,
        Instant staleFlaggedAt,
        RunCounters counters
) {
}
