package com.kmg.analysis.service;

import com.kmg.analysis.model.RunItemRecord;
import com.kmg.analysis.model.RunItemState;
import com.kmg.analysis.model.RunStatus;
import com.kmg.analysis.support.AnalysisEngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunLifecycleServiceTest {

    @TempDir
    Path tempDir;

    private AnalysisEngineFixture fx;

    @BeforeEach
    void setUp() {
        fx = new AnalysisEngineFixture(tempDir);
    }

    @Test
    void failRunSkipsQueuedButLeavesClaimedItems() {
        long runId = fx.createRunWithItems(3);
        List<RunItemRecord> claimed = fx.claimService.claim(runId, 1, "w1");

        assertThat(fx.lifecycleService.failRun(runId, "Authorization failure")).isTrue();
        assertThat(fx.lifecycleService.failRun(runId, "again")).isFalse();

        assertThat(fx.runItemRepository.findById(claimed.get(0).id()).orElseThrow().state())
                .isEqualTo(RunItemState.PROCESSING);
        assertThat(fx.runItemRepository.findByRunId(runId))
                .filteredOn(item -> item.state() == RunItemState.SKIPPED)
                .hasSize(2)
                .allMatch(item -> "RUN_FAILED".equals(item.lastErrorCode()));
        assertThat(fx.runRepository.findRunById(runId).orElseThrow().lastError()).isEqualTo("Authorization failure");
    }

    @Test
    void deferOnHaltedRunSkipsItem() {
        long runId = fx.createRunWithItems(1);
        RunItemRecord item = fx.claimService.claim(runId, 1, "w1").get(0);
        fx.lifecycleService.cancel(runId);

        fx.runItemRepository.defer(item.id(), item.claimToken(), fx.clock.instant(), "E429", "rate limited", fx.clock.instant());

        RunItemRecord after = fx.runItemRepository.findById(item.id()).orElseThrow();
        assertThat(after.state()).isEqualTo(RunItemState.SKIPPED);
        assertThat(after.completedAt()).isEqualTo(fx.clock.instant());
    }

    @Test
    void finishIfDrainedReportsNewStatus() {
        long runId = fx.createRunWithItems(1);
        RunItemRecord item = fx.claimService.claim(runId, 1, "w1").get(0);

        assertThat(fx.lifecycleService.finishIfDrained(runId)).isNull();
        fx.runItemRepository.complete(item.id(), item.claimToken(), 1, 42, 0.0, null, null, fx.clock.instant());

        assertThat(fx.lifecycleService.finishIfDrained(runId)).isEqualTo(RunStatus.COMPLETED);
        assertThat(fx.lifecycleService.finishIfDrained(runId)).isNull();
    }
}
