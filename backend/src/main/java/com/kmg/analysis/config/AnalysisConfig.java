package com.kmg.analysis.config;

import com.kmg.analysis.service.BackoffCalculator;
import com.kmg.analysis.service.ErrorClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalysisConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffCalculator backoffCalculator(AnalysisProperties properties) {
        AnalysisProperties.Backoff backoff = properties.getBackoff();
        return new BackoffCalculator(backoff.getBaseDelay(), backoff.getMaxDelay(), backoff.getJitterFactor());
    }

    @Bean
    public CircuitBreakerRegistry classifierCircuitBreakers(AnalysisProperties properties, ErrorClassifier errorClassifier) {
        return buildCircuitBreakers(properties.getClassifier(), errorClassifier);
    }

    // opens after N consecutive provider outages; parse and auth failures do not count
    public static CircuitBreakerRegistry buildCircuitBreakers(AnalysisProperties.Classifier classifier,
                                                              ErrorClassifier errorClassifier) {
        int threshold = classifier.getCircuitFailureThreshold();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(classifier.getCircuitOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(2)
                .recordException(ex -> errorClassifier.classify(ex).isRetryable())
                .build();
        return CircuitBreakerRegistry.of(config);
    }
}
