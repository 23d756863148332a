package com.kmg.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.analysis.classifier.ClassificationClient;
import com.kmg.analysis.classifier.ClassificationOutcome;
import com.kmg.analysis.classifier.FallbackResults;
import com.kmg.analysis.classifier.ModelCatalog;
import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.model.ClassificationPayload;
import com.kmg.analysis.model.ContentItem;
import com.kmg.analysis.model.FailureKind;
import com.kmg.analysis.model.RunItemRecord;
import com.kmg.analysis.model.RunRecord;
import com.kmg.analysis.repo.AnalysisResultRepository;
import com.kmg.analysis.repo.ContentItemRepository;
import com.kmg.analysis.repo.RunItemRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Every write is conditioned on the item's claim token; a write that finds the claim gone is rolled
 * back and reported as {@link Outcome#CLAIM_LOST}.
 */
@Service
public class ItemProcessor {
    private static final Logger log = LoggerFactory.getLogger(ItemProcessor.class);

    static final String NO_DATA_CODE = "ENODATA";
    static final String BREAKER_PREFIX = "classifier-";
    private static final int MAX_ERROR_MESSAGE = 500;

    public enum Outcome {
        COMPLETED,
        COMPLETED_FALLBACK,
        DEFERRED,
        FAILED,
        RUN_HALTED,
        CLAIM_LOST
    }

    public record Result(Outcome outcome, double costUsd) {
        static Result of(Outcome outcome) {
            return new Result(outcome, 0.0);
        }
    }

    private final ContentItemRepository contentItemRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final RunItemRepository runItemRepository;
    private final RunLifecycleService runLifecycleService;
    private final RateLimiterService rateLimiterService;
    private final ClassificationClient classificationClient;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ErrorClassifier errorClassifier;
    private final BackoffCalculator backoffCalculator;
    private final ModelCatalog modelCatalog;
    private final TransactionTemplate transactionTemplate;
    private final TimeService timeService;
    private final AnalysisProperties properties;
    private final ObjectMapper objectMapper;

    public ItemProcessor(
            ContentItemRepository contentItemRepository,
            AnalysisResultRepository analysisResultRepository,
            RunItemRepository runItemRepository,
            RunLifecycleService runLifecycleService,
            RateLimiterService rateLimiterService,
            ClassificationClient classificationClient,
            CircuitBreakerRegistry circuitBreakers,
            ErrorClassifier errorClassifier,
            BackoffCalculator backoffCalculator,
            ModelCatalog modelCatalog,
            TransactionTemplate transactionTemplate,
            TimeService timeService,
            AnalysisProperties properties,
            ObjectMapper objectMapper
    ) {
        this.contentItemRepository = contentItemRepository;
        this.analysisResultRepository = analysisResultRepository;
        this.runItemRepository = runItemRepository;
        this.runLifecycleService = runLifecycleService;
        this.rateLimiterService = rateLimiterService;
        this.classificationClient = classificationClient;
        this.circuitBreakers = circuitBreakers;
        this.errorClassifier = errorClassifier;
        this.backoffCalculator = backoffCalculator;
        this.modelCatalog = modelCatalog;
        this.transactionTemplate = transactionTemplate;
        this.timeService = timeService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Result process(RunRecord run, RunItemRecord item) throws InterruptedException {
        String modelTag = modelCatalog.resolveTag(run.params().modelTag());
        runItemRepository.touchClaims(item.claimToken(), timeService.now());

        Optional<ContentItem> content = contentItemRepository.findById(item.contentItemId());
        if (content.isEmpty()) {
            log.warn("Content item {} for run item {} does not exist", item.contentItemId(), item.id());
            return failItem(item, NO_DATA_CODE, "Content item " + item.contentItemId() + " not found");
        }

        if (run.params().dryRun()) {
            int tokens = properties.getClassifier().getEstimatedTokensPerItem();
            double cost = modelCatalog.costFor(modelTag, tokens);
            boolean stored = persistCompletion(item, null, modelTag, false, tokens, cost, null, null);
            return stored ? new Result(Outcome.COMPLETED, cost) : Result.of(Outcome.CLAIM_LOST);
        }

        rateLimiterService.acquire(run.id(), run.params().ratePerSecond());
        runItemRepository.touchClaims(item.claimToken(), timeService.now());

        CircuitBreaker breaker = circuitBreakers.circuitBreaker(BREAKER_PREFIX + modelTag);
        ClassificationOutcome outcome;
        try {
            outcome = breaker.executeSupplier(() ->
                    classificationClient.classify(content.get(), modelTag, properties.getClassifier().getCallTimeout()));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit for {} is open; item {} not sent", modelTag, item.id());
            return handleFailure(run, item, modelTag, e);
        } catch (RuntimeException e) {
            return handleFailure(run, item, modelTag, e);
        }

        int tokens = outcome.tokensUsed() != null
                ? outcome.tokensUsed()
                : properties.getClassifier().getEstimatedTokensPerItem();
        double cost = modelCatalog.costFor(modelTag, tokens);
        boolean stored = persistCompletion(item, outcome.payload(), modelTag, false, tokens, cost, null, null);
        if (!stored) {
            return Result.of(Outcome.CLAIM_LOST);
        }
        log.debug("Item {} (content {}) classified with {} ({} tokens)", item.id(), item.contentItemId(), modelTag, tokens);
        return new Result(Outcome.COMPLETED, cost);
    }

    public Result failHalted(RunItemRecord item, FailureKind kind, String message) {
        return failItem(item, kind.code(), message);
    }

    public Result failUnexpected(RunItemRecord item, RuntimeException error) {
        FailureKind kind = errorClassifier.classify(error);
        return failItem(item, kind.code(), error.getMessage());
    }

    public boolean release(RunItemRecord item) {
        boolean released = runItemRepository.releaseClaim(item.id(), item.claimToken(), timeService.now());
        if (!released) {
            log.warn("Claim on item {} was lost before it could be released", item.id());
        }
        return released;
    }

    private Result handleFailure(RunRecord run, RunItemRecord item, String modelTag, RuntimeException error) {
        int attemptCount = item.attemptCount() + 1;
        ErrorClassifier.Decision decision = errorClassifier.decide(error, attemptCount, properties.getWorker().getMaxAttempts());
        String code = decision.kind().code();
        String message = truncate(error.getMessage());

        switch (decision.disposition()) {
            case DEFER -> {
                Duration delay = backoffCalculator.delayFor(attemptCount);
                Instant now = timeService.now();
                boolean deferred = runItemRepository.defer(item.id(), item.claimToken(), now.plus(delay), code, message, now);
                if (!deferred) {
                    log.warn("Claim on item {} was lost before deferral", item.id());
                    return Result.of(Outcome.CLAIM_LOST);
                }
                log.info("Item {} deferred after {} (attempt {}/{}, retry in {} ms)",
                        item.id(), code, attemptCount, properties.getWorker().getMaxAttempts(), delay.toMillis());
                return Result.of(Outcome.DEFERRED);
            }
            case COMPLETE_WITH_FALLBACK -> {
                boolean stored = persistCompletion(item, FallbackResults.neutral(), modelTag, true, null, 0.0, code, message);
                if (!stored) {
                    return Result.of(Outcome.CLAIM_LOST);
                }
                log.warn("Item {} completed with fallback result after {} (attempt {})", item.id(), code, attemptCount);
                return Result.of(Outcome.COMPLETED_FALLBACK);
            }
            case FAIL_RUN -> {
                failItem(item, code, message);
                runLifecycleService.failRun(run.id(), "Authorization failure: " + message);
                return Result.of(Outcome.RUN_HALTED);
            }
            default -> {
                log.error("Item {} failed with {}: {}", item.id(), code, message, error);
                return failItem(item, code, message);
            }
        }
    }

    private Result failItem(RunItemRecord item, String code, String message) {
        boolean failed = runItemRepository.fail(item.id(), item.claimToken(), code, truncate(message), timeService.now());
        if (!failed) {
            log.warn("Claim on item {} was lost before it could be failed", item.id());
            return Result.of(Outcome.CLAIM_LOST);
        }
        return Result.of(Outcome.FAILED);
    }

    private boolean persistCompletion(RunItemRecord item, ClassificationPayload payload, String modelTag, boolean fallback,
                                      Integer tokens, double cost, String code, String message) {
        String sentimentJson = payload == null ? null : toJson(payload.sentiment());
        String impactJson = payload == null ? null : toJson(payload.impact());

        Boolean stored = transactionTemplate.execute(status -> {
            Instant now = timeService.now();
            if (payload != null) {
                analysisResultRepository.upsert(item.contentItemId(), sentimentJson, impactJson, modelTag, fallback, now);
            }
            boolean completed = runItemRepository.complete(
                    item.id(), item.claimToken(), item.attemptCount() + 1, tokens, cost, code, message, now);
            if (!completed) {
                status.setRollbackOnly();
            }
            return completed;
        });

        if (!Boolean.TRUE.equals(stored)) {
            log.warn("Claim on item {} was lost; result for content {} discarded", item.id(), item.contentItemId());
            return false;
        }
        return true;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize classification payload", e);
        }
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_MESSAGE ? message.substring(0, MAX_ERROR_MESSAGE) : message;
    }
}
