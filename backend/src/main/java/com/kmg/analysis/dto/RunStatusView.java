package com.kmg.analysis.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.analysis.model.RunStatus;

public record RunStatusView(
        long id,
        RunStatus status,
        JsonNode scope,
        String modelTag,
        Double ratePerSecond,
        int itemLimit,
        boolean dryRun,
        String triggeredBy,
        int totalItems,
        int queuedCount,
        int processingCount,
        int completedCount,
        int failedCount,
        int skippedCount,
        double progressPercent,
        double errorRate,
        long totalTokens,
        double actualCostUsd,
        String createdAt,
        String startedAt,
        String completedAt,
        String heartbeatAt,
        Long heartbeatAgeSeconds,
        boolean staleFlagged,
        String lastError
) {
}
