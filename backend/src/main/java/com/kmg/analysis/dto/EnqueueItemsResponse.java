package com.kmg.analysis.dto;

public record EnqueueItemsResponse(long runId, int enqueued, int ignored, int totalItems) {
}
