package com.kmg.analysis.dto;

public record CreateRunResponse(long runId, int enqueued, int ignored) {
}
