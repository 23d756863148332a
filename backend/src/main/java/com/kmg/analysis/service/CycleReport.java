package com.kmg.analysis.service;

import java.time.Instant;

public record CycleReport(
        String workerId,
        Instant startedAt,
        long durationMillis,
        int runsScanned,
        int claimed,
        int completed,
        int completedWithFallback,
        int deferred,
        int failed,
        int released,
        int claimsLost,
        double costUsd,
        Long oldestHeartbeatAgeMillis
) {
    public boolean idle() {
        return claimed == 0;
    }
}
