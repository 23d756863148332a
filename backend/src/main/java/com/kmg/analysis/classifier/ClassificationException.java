package com.kmg.analysis.classifier;

import com.kmg.analysis.model.FailureKind;

public class ClassificationException extends RuntimeException {
    private final FailureKind kind;

    public ClassificationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ClassificationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
