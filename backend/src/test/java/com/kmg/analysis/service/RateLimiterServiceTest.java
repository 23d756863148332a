package com.kmg.analysis.service;

import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.repo.RunThrottleRepository;
import com.kmg.analysis.support.AnalysisEngineFixture;
import com.kmg.analysis.support.TestDatabase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void pacesRequestsAtConfiguredRate() throws Exception {
        RateLimiterService limiter = limiter(AnalysisEngineFixture.defaultProperties());

        long firstSlot = limiter.acquire(1L, 2.0);
        long lastSlot = firstSlot;
        for (int i = 1; i < 10; i++) {
            lastSlot = limiter.acquire(1L, 2.0);
        }

        // ten slots at 500 ms spacing, the first one immediate
        assertThat(lastSlot - firstSlot).isGreaterThanOrEqualTo(4500);
        assertThat(System.currentTimeMillis() - firstSlot).isGreaterThanOrEqualTo(4500);
    }

    @Test
    void runsArePacedIndependently() throws Exception {
        RateLimiterService limiter = limiter(AnalysisEngineFixture.defaultProperties());
        limiter.acquire(1L, 0.5);

        long start = System.nanoTime();
        limiter.acquire(2L, 0.5);

        assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(1000);
    }

    @Test
    void invalidRateFallsBackToDefault() {
        AnalysisProperties properties = AnalysisEngineFixture.defaultProperties();
        properties.getClassifier().setDefaultRatePerSecond(4.0);
        RateLimiterService limiter = limiter(properties);

        assertThat(limiter.effectiveRate(null)).isEqualTo(4.0);
        assertThat(limiter.effectiveRate(0.0)).isEqualTo(4.0);
        assertThat(limiter.effectiveRate(-3.0)).isEqualTo(4.0);
        assertThat(limiter.effectiveRate(Double.NaN)).isEqualTo(4.0);
        assertThat(limiter.effectiveRate(2.5)).isEqualTo(2.5);
        assertThat(limiter.intervalMillis(0.0)).isEqualTo(250);
    }

    @Test
    void minimumIntervalIsAFloor() {
        AnalysisProperties properties = AnalysisEngineFixture.defaultProperties();
        properties.getWorker().setMinRequestInterval(Duration.ofMillis(500));
        RateLimiterService limiter = limiter(properties);

        assertThat(limiter.intervalMillis(100.0)).isEqualTo(500);
        assertThat(limiter.intervalMillis(1.0)).isEqualTo(1000);
        assertThat(limiter.intervalMillis(3.0)).isEqualTo(500);
        assertThat(limiter.intervalMillis(0.3)).isEqualTo(3334);
    }

    private RateLimiterService limiter(AnalysisProperties properties) {
        TestDatabase db = TestDatabase.create(tempDir);
        return new RateLimiterService(new RunThrottleRepository(db.jdbc()), new TimeService(Clock.systemUTC()), properties);
    }
}
