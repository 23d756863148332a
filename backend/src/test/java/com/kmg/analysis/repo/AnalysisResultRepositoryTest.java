package com.kmg.analysis.repo;

import com.kmg.analysis.model.AnalysisResultRecord;
import com.kmg.analysis.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisResultRepositoryTest {

    @TempDir
    Path tempDir;

    private AnalysisResultRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AnalysisResultRepository(TestDatabase.create(tempDir).jdbc());
    }

    @Test
    void secondWriteForSameContentItemOverwritesFirst() {
        Instant first = Instant.parse("2025-01-06T09:00:00Z");
        Instant second = first.plusSeconds(30);

        repository.upsert(42L, "{\"overall\":{\"label\":\"positive\"}}", "{\"overall\":0.7}", "gpt-4.1-nano", false, first);
        repository.upsert(42L, "{\"overall\":{\"label\":\"negative\"}}", "{\"overall\":0.2}", "gpt-4o", true, second);

        assertThat(repository.countByContentItemId(42L)).isEqualTo(1);
        AnalysisResultRecord stored = repository.findByContentItemId(42L).orElseThrow();
        assertThat(stored.sentimentJson()).contains("negative");
        assertThat(stored.impactJson()).isEqualTo("{\"overall\":0.2}");
        assertThat(stored.modelTag()).isEqualTo("gpt-4o");
        assertThat(stored.fallback()).isTrue();
        assertThat(stored.updatedAt()).isEqualTo(second);
    }

    @Test
    void resultsAreKeyedByContentItem() {
        Instant now = Instant.parse("2025-01-06T09:00:00Z");
        repository.upsert(1L, "{}", "{}", "gpt-4.1-nano", false, now);
        repository.upsert(2L, "{}", "{}", "gpt-4.1-nano", false, now);

        assertThat(repository.countByContentItemId(1L)).isEqualTo(1);
        assertThat(repository.countByContentItemId(2L)).isEqualTo(1);
        assertThat(repository.findByContentItemId(3L)).isEmpty();
    }
}
