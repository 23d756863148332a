package com.kmg.analysis.model;

import java.time.Instant;

public record AnalysisResultRecord(
        long contentItemId,
        String sentimentJson,
        String impactJson,
        String modelTag,
        boolean fallback,
        Instant updatedAt
) {
}
