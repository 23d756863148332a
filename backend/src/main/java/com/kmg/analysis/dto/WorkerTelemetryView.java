package com.kmg.analysis.dto;

import com.kmg.analysis.service.CycleReport;

import java.util.Map;

public record WorkerTelemetryView(
        long cycles,
        long idleCycles,
        long claimed,
        long completed,
        long completedWithFallback,
        long deferred,
        long failed,
        long cycleErrors,
        double costUsd,
        Map<String, CycleReport> lastCycleByWorker
) {
}
