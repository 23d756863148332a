package com.kmg.analysis.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.analysis.dto.CreateRunRequest;
import com.kmg.analysis.dto.CreateRunResponse;
import com.kmg.analysis.dto.DeferredStatsView;
import com.kmg.analysis.dto.EnqueueItemsResponse;
import com.kmg.analysis.dto.RunStatusView;
import com.kmg.analysis.model.RunItemRecord;
import com.kmg.analysis.model.RunStatus;
import com.kmg.analysis.support.AnalysisEngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunServiceTest {

    @TempDir
    Path tempDir;

    private AnalysisEngineFixture fx;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        fx = new AnalysisEngineFixture(tempDir);
    }

    @Test
    void createsPendingRunWithDeduplicatedItems() throws Exception {
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"rss\",\"window\":\"24h\"}",
                null, Arrays.asList(5L, 3L, 5L, 8L)));

        assertThat(response.enqueued()).isEqualTo(3);
        assertThat(response.ignored()).isEqualTo(1);

        RunStatusView view = fx.runService.getRunStatus(response.runId());
        assertThat(view.status()).isEqualTo(RunStatus.PENDING);
        assertThat(view.modelTag()).isEqualTo("gpt-4.1-nano");
        assertThat(view.itemLimit()).isEqualTo(200);
        assertThat(view.totalItems()).isEqualTo(3);
        assertThat(view.queuedCount()).isEqualTo(3);
        assertThat(view.progressPercent()).isZero();
        assertThat(view.scope().get("source").asText()).isEqualTo("rss");
        assertThat(view.heartbeatAt()).isNull();
        assertThat(view.staleFlagged()).isFalse();
    }

    @Test
    void rejectsSecondActiveRunWithEquivalentScope() throws Exception {
        fx.runService.createRun(request("{\"source\":\"rss\",\"window\":\"24h\"}", null, List.of(1L)));

        assertThatThrownBy(() -> fx.runService.createRun(request("{\"window\":\"24h\",\"source\":\"rss\"}", null, List.of(2L))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("same scope");
        assertThat(fx.runService.listActiveRuns()).hasSize(1);
    }

    @Test
    void scopeCanBeReusedOnceEarlierRunIsTerminal() throws Exception {
        CreateRunResponse first = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L)));
        fx.runService.cancelRun(first.runId());

        CreateRunResponse second = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L)));

        assertThat(second.runId()).isNotEqualTo(first.runId());
    }

    @Test
    void itemLimitCapsEnqueuedItems() throws Exception {
        List<Long> ids = LongStream.rangeClosed(1, 10).boxed().toList();
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"limited\"}", 4, ids));

        assertThat(response.enqueued()).isEqualTo(4);
        assertThat(response.ignored()).isEqualTo(6);

        EnqueueItemsResponse more = fx.runService.enqueueItems(response.runId(), List.of(20L));
        assertThat(more.enqueued()).isZero();
        assertThat(more.totalItems()).isEqualTo(4);
    }

    @Test
    void enqueueSkipsItemsAlreadyInRun() throws Exception {
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L, 2L)));

        EnqueueItemsResponse more = fx.runService.enqueueItems(response.runId(), List.of(2L, 3L));

        assertThat(more.enqueued()).isEqualTo(1);
        assertThat(more.ignored()).isEqualTo(1);
        assertThat(more.totalItems()).isEqualTo(3);
    }

    @Test
    void enqueueIntoTerminalRunIsRejected() throws Exception {
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L)));
        fx.runService.cancelRun(response.runId());

        assertThatThrownBy(() -> fx.runService.enqueueItems(response.runId(), List.of(2L)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CANCELLED");
        assertThatThrownBy(() -> fx.runService.enqueueItems(999L, List.of(2L)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void cancelSkipsQueuedItemsAndRejectsRepeat() throws Exception {
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L, 2L)));

        RunStatusView view = fx.runService.cancelRun(response.runId());

        assertThat(view.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(view.skippedCount()).isEqualTo(2);
        assertThat(view.completedAt()).isNotNull();
        assertThatThrownBy(() -> fx.runService.cancelRun(response.runId()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> fx.runService.cancelRun(12345L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusReportsHeartbeatAge() throws Exception {
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L)));
        fx.lifecycleService.heartbeat(response.runId());
        fx.clock.advance(Duration.ofSeconds(42));

        RunStatusView view = fx.runService.getRunStatus(response.runId());

        assertThat(view.heartbeatAgeSeconds()).isEqualTo(42L);
        assertThatThrownBy(() -> fx.runService.getRunStatus(777L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deferredStatsGroupByErrorCode() throws Exception {
        CreateRunResponse response = fx.runService.createRun(request("{\"source\":\"rss\"}", null, List.of(1L, 2L, 3L)));
        long runId = response.runId();
        List<RunItemRecord> claimed = fx.claimService.claim(runId, 3, "w1");
        fx.runItemRepository.defer(claimed.get(0).id(), claimed.get(0).claimToken(), fx.clock.instant(),
                "E429", "rate limited", fx.clock.instant());
        fx.runItemRepository.defer(claimed.get(1).id(), claimed.get(1).claimToken(), fx.clock.instant().plusSeconds(30),
                "ETIMEOUT", "timed out", fx.clock.instant());

        DeferredStatsView stats = fx.runService.getDeferredStats(runId);

        assertThat(stats.deferredTotal()).isEqualTo(2);
        assertThat(stats.readyNow()).isEqualTo(1);
        assertThat(stats.waiting()).isEqualTo(1);
        assertThat(stats.nextAvailableAt()).isEqualTo(fx.clock.instant().plusSeconds(30).toString());
        assertThat(stats.maxAttemptCount()).isEqualTo(1);
        assertThat(stats.byErrorCode()).containsEntry("E429", 1L).containsEntry("ETIMEOUT", 1L);

        assertThat(fx.runService.getDeferredStats(null).deferredTotal()).isEqualTo(2);
        assertThatThrownBy(() -> fx.runService.getDeferredStats(404L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private CreateRunRequest request(String scopeJson, Integer itemLimit, List<Long> ids) throws Exception {
        JsonNode scope = mapper.readTree(scopeJson);
        return new CreateRunRequest(scope, null, 2.0, itemLimit, false, "test", ids);
    }
}
