package com.kmg.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.kmg.analysis.classifier.ClassificationException;
import com.kmg.analysis.model.FailureKind;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

@Component
public class ErrorClassifier {
    private static final Pattern RATE_LIMIT_STATUS = Pattern.compile("\\b429\\b");
    private static final Pattern SERVER_STATUS = Pattern.compile("\\b50[0234]\\b");
    private static final Pattern TIMEOUT_TEXT =
            Pattern.compile("timeout|timed out|connection (refused|reset|closed)|connect failed");

    public enum Disposition {
        DEFER,
        COMPLETE_WITH_FALLBACK,
        FAIL_ITEM,
        FAIL_RUN
    }

    public record Decision(FailureKind kind, Disposition disposition, int attemptCount) {
    }

    public Decision decide(Throwable error, int attemptCount, int maxAttempts) {
        FailureKind kind = classify(error);
        if (kind.isRetryable()) {
            Disposition disposition = attemptCount >= maxAttempts ? Disposition.COMPLETE_WITH_FALLBACK : Disposition.DEFER;
            return new Decision(kind, disposition, attemptCount);
        }
        Disposition disposition = switch (kind) {
            case PARSE_ERROR -> Disposition.COMPLETE_WITH_FALLBACK;
            case AUTH_ERROR -> Disposition.FAIL_RUN;
            default -> Disposition.FAIL_ITEM;
        };
        return new Decision(kind, disposition, attemptCount);
    }

    public FailureKind classify(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            FailureKind kind = classifyType(current);
            if (kind != null) {
                return kind;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return classifyMessage(error == null ? null : error.getMessage());
    }

    private FailureKind classifyType(Throwable error) {
        if (error instanceof ClassificationException classified) {
            return classified.kind();
        }
        if (error instanceof CallNotPermittedException) {
            return FailureKind.SERVER_ERROR;
        }
        if (error instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 429) {
                return FailureKind.RATE_LIMITED;
            }
            if (status == 401 || status == 403) {
                return FailureKind.AUTH_ERROR;
            }
            if (status >= 500) {
                return FailureKind.SERVER_ERROR;
            }
            return null;
        }
        if (error instanceof SocketTimeoutException
                || error instanceof HttpTimeoutException
                || error instanceof TimeoutException
                || error instanceof ResourceAccessException) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof JsonProcessingException) {
            return FailureKind.PARSE_ERROR;
        }
        return null;
    }

    private FailureKind classifyMessage(String message) {
        if (message == null) {
            return FailureKind.UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (RATE_LIMIT_STATUS.matcher(lower).find() || lower.contains("rate limit")) {
            return FailureKind.RATE_LIMITED;
        }
        if (SERVER_STATUS.matcher(lower).find()) {
            return FailureKind.SERVER_ERROR;
        }
        if (lower.contains("parse") || lower.contains("json")) {
            return FailureKind.PARSE_ERROR;
        }
        if (TIMEOUT_TEXT.matcher(lower).find()) {
            return FailureKind.TIMEOUT;
        }
        if (lower.contains("unauthorized") || lower.contains("invalid api key") || lower.contains("authentication")) {
            return FailureKind.AUTH_ERROR;
        }
        return FailureKind.UNKNOWN;
    }
}
