package com.kmg.analysis.service;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.kmg.analysis.classifier.ClassificationException;
import com.kmg.analysis.model.FailureKind;
import com.kmg.analysis.service.ErrorClassifier.Disposition;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void classifiesHttpStatusErrors() {
        assertThat(classifier.classify(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)))
                .isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(classifier.classify(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)))
                .isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(classifier.classify(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)))
                .isEqualTo(FailureKind.AUTH_ERROR);
        assertThat(classifier.classify(new HttpClientErrorException(HttpStatus.FORBIDDEN)))
                .isEqualTo(FailureKind.AUTH_ERROR);
        assertThat(classifier.classify(new HttpClientErrorException(HttpStatus.BAD_REQUEST)))
                .isEqualTo(FailureKind.UNKNOWN);
    }

    @Test
    void classifiesTransportAndParseErrors() {
        assertThat(classifier.classify(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"))))
                .isEqualTo(FailureKind.TIMEOUT);
        assertThat(classifier.classify(new HttpTimeoutException("request timed out")))
                .isEqualTo(FailureKind.TIMEOUT);
        assertThat(classifier.classify(new JsonParseException((JsonParser) null, "Unexpected character")))
                .isEqualTo(FailureKind.PARSE_ERROR);
    }

    @Test
    void followsCauseChain() {
        RuntimeException wrapped = new RuntimeException("call failed", new SocketTimeoutException("Read timed out"));
        assertThat(classifier.classify(wrapped)).isEqualTo(FailureKind.TIMEOUT);

        RuntimeException classified = new IllegalStateException("outer",
                new ClassificationException(FailureKind.AUTH_ERROR, "key revoked"));
        assertThat(classifier.classify(classified)).isEqualTo(FailureKind.AUTH_ERROR);
    }

    @Test
    void fallsBackToMessageHints() {
        assertThat(classifier.classify(new RuntimeException("Rate limit reached for requests"))).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(classifier.classify(new RuntimeException("upstream answered 503"))).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(classifier.classify(new RuntimeException("could not parse body"))).isEqualTo(FailureKind.PARSE_ERROR);
        assertThat(classifier.classify(new RuntimeException("connection reset"))).isEqualTo(FailureKind.TIMEOUT);
        assertThat(classifier.classify(new RuntimeException("Invalid API key provided"))).isEqualTo(FailureKind.AUTH_ERROR);
        assertThat(classifier.classify(new RuntimeException("something odd"))).isEqualTo(FailureKind.UNKNOWN);
        assertThat(classifier.classify(new RuntimeException())).isEqualTo(FailureKind.UNKNOWN);
    }

    @Test
    void statusCodesMatchOnlyAsWholeNumbers() {
        assertThat(classifier.classify(new RuntimeException("prompt exceeds 5000 characters"))).isEqualTo(FailureKind.UNKNOWN);
        assertThat(classifier.classify(new RuntimeException("request id 14290 rejected"))).isEqualTo(FailureKind.UNKNOWN);
        assertThat(classifier.classify(new RuntimeException("status=502 from gateway"))).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(classifier.classify(new RuntimeException("HTTP 429 Too Many Requests"))).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(classifier.classify(new RuntimeException("connection pool exhausted"))).isEqualTo(FailureKind.UNKNOWN);
        assertThat(classifier.classify(new RuntimeException("Connection refused"))).isEqualTo(FailureKind.TIMEOUT);
    }

    @Test
    void openCircuitCountsAsServerError() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("classifier-test");
        breaker.transitionToOpenState();

        CallNotPermittedException rejected = CallNotPermittedException.createCallNotPermittedException(breaker);

        assertThat(classifier.classify(rejected)).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(classifier.decide(rejected, 1, 3).disposition()).isEqualTo(Disposition.DEFER);
    }

    @Test
    void retryableKindsDeferUntilCeiling() {
        ClassificationException timeout = new ClassificationException(FailureKind.TIMEOUT, "slow");

        assertThat(classifier.decide(timeout, 1, 3).disposition()).isEqualTo(Disposition.DEFER);
        assertThat(classifier.decide(timeout, 2, 3).disposition()).isEqualTo(Disposition.DEFER);
        assertThat(classifier.decide(timeout, 3, 3).disposition()).isEqualTo(Disposition.COMPLETE_WITH_FALLBACK);
    }

    @Test
    void nonRetryableKindsHaveFixedDisposition() {
        assertThat(classifier.decide(new ClassificationException(FailureKind.PARSE_ERROR, "bad"), 1, 3).disposition())
                .isEqualTo(Disposition.COMPLETE_WITH_FALLBACK);
        assertThat(classifier.decide(new ClassificationException(FailureKind.AUTH_ERROR, "denied"), 1, 3).disposition())
                .isEqualTo(Disposition.FAIL_RUN);
        ErrorClassifier.Decision unknown = classifier.decide(new IllegalStateException("weird"), 1, 3);
        assertThat(unknown.disposition()).isEqualTo(Disposition.FAIL_ITEM);
        assertThat(unknown.kind().code()).isEqualTo("EUNKNOWN");
    }
}
