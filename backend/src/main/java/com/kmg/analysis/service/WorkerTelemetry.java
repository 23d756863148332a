package com.kmg.analysis.service;

import com.kmg.analysis.dto.WorkerTelemetryView;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class WorkerTelemetry implements MeterBinder {
    private static final Tags TAGS = Tags.of("component", "analysis-worker");

    private final Map<String, CycleReport> lastCycles = new LinkedHashMap<>();
    private final AtomicLong oldestHeartbeatAge = new AtomicLong();

    private final Counter cycles;
    private final Counter idleCycles;
    private final Counter claimed;
    private final Counter completed;
    private final Counter completedWithFallback;
    private final Counter deferred;
    private final Counter failed;
    private final Counter claimsLost;
    private final Counter cycleErrors;
    private final DistributionSummary cycleCost;

    public WorkerTelemetry(MeterRegistry registry) {
        this.cycles = counter(registry, "analysis.worker.cycles", "Worker cycles run");
        this.idleCycles = counter(registry, "analysis.worker.cycles.idle", "Worker cycles that claimed nothing");
        this.claimed = counter(registry, "analysis.items.claimed", "Run items claimed");
        this.completed = counter(registry, "analysis.items.completed", "Run items completed, fallbacks included");
        this.completedWithFallback = counter(registry, "analysis.items.fallback", "Run items completed with the neutral fallback");
        this.deferred = counter(registry, "analysis.items.deferred", "Run items requeued with backoff");
        this.failed = counter(registry, "analysis.items.failed", "Run items failed");
        this.claimsLost = counter(registry, "analysis.claims.lost", "Results discarded because the claim was reclaimed");
        this.cycleErrors = counter(registry, "analysis.worker.cycle.errors", "Worker cycles aborted by an error");
        this.cycleCost = DistributionSummary.builder("analysis.cycle.cost")
                .description("Provider cost of one worker cycle")
                .baseUnit("usd")
                .tags(TAGS)
                .register(registry);
    }

    // Spring Boot binds MeterBinder beans once the registry is ready
    @Override
    public void bindTo(MeterRegistry registry) {
        registry.gauge("analysis.run.heartbeat.age.ms", TAGS, oldestHeartbeatAge, AtomicLong::get);
    }

    public void record(CycleReport report) {
        synchronized (lastCycles) {
            lastCycles.put(report.workerId(), report);
        }
        cycles.increment();
        if (report.idle()) {
            idleCycles.increment();
        }
        claimed.increment(report.claimed());
        completed.increment(report.completed());
        completedWithFallback.increment(report.completedWithFallback());
        deferred.increment(report.deferred());
        failed.increment(report.failed());
        claimsLost.increment(report.claimsLost());
        cycleCost.record(report.costUsd());
        oldestHeartbeatAge.set(report.oldestHeartbeatAgeMillis() == null ? 0 : report.oldestHeartbeatAgeMillis());
    }

    public void recordCycleError() {
        cycleErrors.increment();
    }

    public WorkerTelemetryView snapshot() {
        Map<String, CycleReport> last;
        synchronized (lastCycles) {
            last = new LinkedHashMap<>(lastCycles);
        }
        return new WorkerTelemetryView(
                (long) cycles.count(),
                (long) idleCycles.count(),
                (long) claimed.count(),
                (long) completed.count(),
                (long) completedWithFallback.count(),
                (long) deferred.count(),
                (long) failed.count(),
                (long) cycleErrors.count(),
                Math.round(cycleCost.totalAmount() * 1_000_000.0) / 1_000_000.0,
                last
        );
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name).description(description).tags(TAGS).register(registry);
    }
}
