package com.kmg.analysis.model;

public enum FailureKind {
    RATE_LIMITED("E429", true),
    SERVER_ERROR("E5XX", true),
    TIMEOUT("ETIMEOUT", true),
    PARSE_ERROR("EPARSE", false),
    AUTH_ERROR("EAUTH", false),
    UNKNOWN("EUNKNOWN", false);

    private final String code;
    private final boolean retryable;

    FailureKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
