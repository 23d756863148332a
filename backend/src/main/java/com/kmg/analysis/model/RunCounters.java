package com.kmg.analysis.model;

public record RunCounters(
        int queued,
        int processing,
        int completed,
        int failed,
        int skipped,
        long totalTokens,
        double actualCostUsd
) {
    public static final RunCounters EMPTY = new RunCounters(0, 0, 0, 0, 0, 0L, 0.0);

    public int total() {
        return queued + processing + completed + failed + skipped;
    }

    public int finished() {
        return completed + failed + skipped;
    }

    public double progressPercent() {
        int total = total();
        if (total == 0) {
            return 0.0;
        }
        return Math.round(finished() * 1000.0 / total) / 10.0;
    }

    public double errorRate() {
        int finished = finished();
        if (finished == 0) {
            return 0.0;
        }
        return Math.round(failed * 10000.0 / finished) / 10000.0;
    }
}
