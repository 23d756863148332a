package com.kmg.analysis.model;

public enum RunItemState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    SKIPPED
}
