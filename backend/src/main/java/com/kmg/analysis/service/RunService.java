package com.kmg.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kmg.analysis.classifier.ModelCatalog;
import com.kmg.analysis.dto.CreateRunRequest;
import com.kmg.analysis.dto.CreateRunResponse;
import com.kmg.analysis.dto.DeferredStatsView;
import com.kmg.analysis.dto.EnqueueItemsResponse;
import com.kmg.analysis.dto.RunStatusView;
import com.kmg.analysis.model.DeferredStats;
import com.kmg.analysis.model.RunCounters;
import com.kmg.analysis.model.RunParams;
import com.kmg.analysis.model.RunRecord;
import com.kmg.analysis.model.RunStatus;
import com.kmg.analysis.repo.RunItemRepository;
import com.kmg.analysis.repo.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class RunService {
    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final int DEFAULT_ITEM_LIMIT = 200;
    private static final int ACTIVE_RUNS_LIMIT = 1000;

    private final RunRepository runRepository;
    private final RunItemRepository runItemRepository;
    private final RunLifecycleService runLifecycleService;
    private final ModelCatalog modelCatalog;
    private final TransactionTemplate transactionTemplate;
    private final TimeService timeService;
    private final ObjectMapper objectMapper;

    public RunService(
            RunRepository runRepository,
            RunItemRepository runItemRepository,
            RunLifecycleService runLifecycleService,
            ModelCatalog modelCatalog,
            TransactionTemplate transactionTemplate,
            TimeService timeService,
            ObjectMapper objectMapper
    ) {
        this.runRepository = runRepository;
        this.runItemRepository = runItemRepository;
        this.runLifecycleService = runLifecycleService;
        this.modelCatalog = modelCatalog;
        this.transactionTemplate = transactionTemplate;
        this.timeService = timeService;
        this.objectMapper = objectMapper;
    }

    public CreateRunResponse createRun(CreateRunRequest request) {
        if (request.scope() == null || request.scope().isNull()) {
            throw new IllegalArgumentException("Run scope is required.");
        }
        String scopeJson = canonicalJson(request.scope());
        String scopeHash = sha256(scopeJson);
        RunParams params = new RunParams(
                modelCatalog.resolveTag(request.modelTag()),
                request.ratePerSecond(),
                request.itemLimit() == null ? DEFAULT_ITEM_LIMIT : request.itemLimit(),
                Boolean.TRUE.equals(request.dryRun())
        );
        if (params.itemLimit() <= 0) {
            throw new IllegalArgumentException("itemLimit must be positive.");
        }
        List<Long> itemIds = request.itemIds() == null ? List.of() : request.itemIds();

        CreateRunResponse response = transactionTemplate.execute(status -> {
            Instant now = timeService.now();
            long runId = runRepository.insertRun(scopeJson, scopeHash, params, request.triggeredBy(), now);
            if (runRepository.countActiveWithScopeHash(scopeHash) > 1) {
                throw new IllegalStateException("An active run with the same scope already exists.");
            }
            EnqueueItemsResponse enqueued = enqueueInto(runId, params.itemLimit(), itemIds, now);
            return new CreateRunResponse(runId, enqueued.enqueued(), enqueued.ignored());
        });

        log.info("Run {} created (model {}, limit {}, dry run {}, {} item(s) enqueued)",
                response.runId(), params.modelTag(), params.itemLimit(), params.dryRun(), response.enqueued());
        return response;
    }

    public EnqueueItemsResponse enqueueItems(long runId, List<Long> itemIds) {
        EnqueueItemsResponse response = transactionTemplate.execute(status -> {
            Instant now = timeService.now();
            if (!runRepository.touchActive(runId, now)) {
                RunStatus current = runRepository.findStatus(runId)
                        .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
                throw new IllegalStateException("Run " + runId + " is " + current + " and accepts no new items.");
            }
            int itemLimit = runRepository.findItemLimit(runId)
                    .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
            return enqueueInto(runId, itemLimit, itemIds, now);
        });
        if (response.ignored() > 0) {
            log.info("Run {}: enqueued {} item(s), ignored {}", runId, response.enqueued(), response.ignored());
        }
        return response;
    }

    private EnqueueItemsResponse enqueueInto(long runId, int itemLimit, List<Long> itemIds, Instant now) {
        Set<Long> existing = new HashSet<>(runItemRepository.findContentItemIds(runId));
        int capacity = Math.max(0, itemLimit - existing.size());

        List<Long> accepted = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(itemIds)) {
            if (accepted.size() >= capacity) {
                break;
            }
            if (id != null && !existing.contains(id)) {
                accepted.add(id);
            }
        }
        int inserted = runItemRepository.insertQueued(runId, accepted, now);
        return new EnqueueItemsResponse(runId, inserted, itemIds.size() - inserted, existing.size() + inserted);
    }

    public RunStatusView getRunStatus(long runId) {
        RunRecord run = runRepository.findRunById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        return toView(run);
    }

    public List<RunStatusView> listActiveRuns() {
        return runRepository.findActiveRuns(ACTIVE_RUNS_LIMIT).stream()
                .map(this::toView)
                .toList();
    }

    public DeferredStatsView getDeferredStats(Long runId) {
        if (runId != null && runRepository.findStatus(runId).isEmpty()) {
            throw new IllegalArgumentException("Run not found: " + runId);
        }
        DeferredStats stats = runItemRepository.deferredStats(runId, timeService.now());
        return new DeferredStatsView(
                runId,
                stats.deferredTotal(),
                stats.readyNow(),
                stats.waiting(),
                toText(stats.nextAvailableAt()),
                stats.maxAttemptCount(),
                stats.byErrorCode()
        );
    }

    public RunStatusView cancelRun(long runId) {
        runLifecycleService.cancel(runId);
        return getRunStatus(runId);
    }

    private RunStatusView toView(RunRecord run) {
        RunCounters counters = run.counters();
        Duration heartbeatAge = timeService.since(run.heartbeatAt());
        return new RunStatusView(
                run.id(),
                run.status(),
                readScope(run.scopeJson()),
                run.params().modelTag(),
                run.params().ratePerSecond(),
                run.params().itemLimit(),
                run.params().dryRun(),
                run.triggeredBy(),
                counters.total(),
                counters.queued(),
                counters.processing(),
                counters.completed(),
                counters.failed(),
                counters.skipped(),
                counters.progressPercent(),
                counters.errorRate(),
                counters.totalTokens(),
                Math.round(counters.actualCostUsd() * 1_000_000.0) / 1_000_000.0,
                toText(run.createdAt()),
                toText(run.startedAt()),
                toText(run.completedAt()),
                toText(run.heartbeatAt()),
                heartbeatAge == null ? null : Math.max(0, heartbeatAge.toSeconds()),
                run.staleFlaggedAt() != null,
                run.lastError()
        );
    }

    private String canonicalJson(JsonNode scope) {
        try {
            Object plain = objectMapper.treeToValue(scope, Object.class);
            return objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Run scope is not valid JSON.", e);
        }
    }

    private JsonNode readScope(String scopeJson) {
        try {
            return objectMapper.readTree(scopeJson);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored run scope is not valid JSON", e);
        }
    }

    private String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private String toText(Object value) {
        return value == null ? null : value.toString();
    }
}
