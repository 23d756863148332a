package com.kmg.analysis.service;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class TimeService {
    private final Clock clock;

    public TimeService(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public long millis() {
        return clock.millis();
    }

    public Duration since(Instant instant) {
        if (instant == null) {
            return null;
        }
        return Duration.between(instant, now());
    }
}
