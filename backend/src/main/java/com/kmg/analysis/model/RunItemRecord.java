package com.kmg.analysis.model;

import java.time.Instant;

public record RunItemRecord(
        long id,
        long runId,
        long contentItemId,
        RunItemState state,
        Instant createdAt,
        Instant claimedAt,
        String claimedBy,
        String claimToken,
        Instant availableAt,
        Instant completedAt,
        int attemptCount,
        String lastErrorCode,
        String lastErrorMessage,
        Integer tokensUsed,
        Double costUsd
) {
}
