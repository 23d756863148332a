package com.kmg.analysis.model;

public record RunParams(
        String modelTag,
        Double ratePerSecond,
        int itemLimit,
        boolean dryRun
) {
}
