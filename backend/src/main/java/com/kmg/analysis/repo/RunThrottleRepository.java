package com.kmg.analysis.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RunThrottleRepository {
    private final JdbcTemplate jdbcTemplate;

    public RunThrottleRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long readNextSlot(long runId) {
        jdbcTemplate.update(
                "INSERT INTO run_throttle(run_id, next_slot_at) VALUES (?, 0) ON CONFLICT(run_id) DO NOTHING",
                runId
        );
        Long next = jdbcTemplate.queryForObject(
                "SELECT next_slot_at FROM run_throttle WHERE run_id = ?",
                Long.class,
                runId
        );
        return next == null ? 0L : next;
    }

    public boolean compareAndSetNextSlot(long runId, long expected, long next) {
        int updated = jdbcTemplate.update(
                "UPDATE run_throttle SET next_slot_at = ? WHERE run_id = ? AND next_slot_at = ?",
                next,
                runId,
                expected
        );
        return updated == 1;
    }
}
