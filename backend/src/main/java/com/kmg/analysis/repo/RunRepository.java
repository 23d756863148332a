package com.kmg.analysis.repo;

import com.kmg.analysis.model.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class RunRepository {
    private static final String SELECT_WITH_COUNTERS = """
            SELECT r.*,
                   COALESCE(SUM(CASE WHEN i.state = 'QUEUED' THEN 1 ELSE 0 END), 0) AS queued_count,
                   COALESCE(SUM(CASE WHEN i.state = 'PROCESSING' THEN 1 ELSE 0 END), 0) AS processing_count,
                   COALESCE(SUM(CASE WHEN i.state = 'COMPLETED' THEN 1 ELSE 0 END), 0) AS completed_count,
                   COALESCE(SUM(CASE WHEN i.state = 'FAILED' THEN 1 ELSE 0 END), 0) AS failed_count,
                   COALESCE(SUM(CASE WHEN i.state = 'SKIPPED' THEN 1 ELSE 0 END), 0) AS skipped_count,
                   COALESCE(SUM(i.tokens_used), 0) AS total_tokens,
                   COALESCE(SUM(i.cost_usd), 0) AS actual_cost
              FROM runs r
              LEFT JOIN run_items i ON i.run_id = r.id
            """;

    private final JdbcTemplate jdbcTemplate;

    public RunRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<RunRecord> RUN_MAPPER = new RowMapper<>() {
        @Override
        public RunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            double rate = rs.getDouble("rate_per_second");
            Double ratePerSecond = rs.wasNull() ? null : rate;
            return new RunRecord(
                    rs.getLong("id"),
                    rs.getString("scope_json"),
                    rs.getString("scope_hash"),
                    new RunParams(
                            rs.getString("model_tag"),
                            ratePerSecond,
                            rs.getInt("item_limit"),
                            rs.getInt("dry_run") == 1
                    ),
                    RunStatus.valueOf(rs.getString("status")),
                    rs.getString("triggered_by"),
                    rs.getString("last_error"),
                    SqlTime.read(rs, "created_at"),
                    SqlTime.read(rs, "updated_at"),
                    SqlTime.read(rs, "started_at"),
                    SqlTime.read(rs, "completed_at"),
                    SqlTime.read(rs, "heartbeat_at"),
                    SqlTime.read(rs, "stale_flagged_at"),
                    new RunCounters(
                            rs.getInt("queued_count"),
                            rs.getInt("processing_count"),
                            rs.getInt("completed_count"),
                            rs.getInt("failed_count"),
                            rs.getInt("skipped_count"),
                            rs.getLong("total_tokens"),
                            rs.getDouble("actual_cost")
                    )
            );
        }
    };

    public long insertRun(String scopeJson, String scopeHash, RunParams params, String triggeredBy, Instant now) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    """
                    INSERT INTO runs(scope_json, scope_hash, model_tag, rate_per_second, item_limit, dry_run,
                                     triggered_by, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, 'PENDING', ?, ?)
                    """,
                    Statement.RETURN_GENERATED_KEYS
            );
            ps.setString(1, scopeJson);
            ps.setString(2, scopeHash);
            ps.setString(3, params.modelTag());
            if (params.ratePerSecond() == null) {
                ps.setNull(4, Types.REAL);
            } else {
                ps.setDouble(4, params.ratePerSecond());
            }
            ps.setInt(5, params.itemLimit());
            ps.setInt(6, params.dryRun() ? 1 : 0);
            ps.setString(7, triggeredBy);
            ps.setLong(8, now.toEpochMilli());
            ps.setLong(9, now.toEpochMilli());
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Run insert returned no generated id");
        }
        return key.longValue();
    }

    public Optional<RunRecord> findRunById(long id) {
        List<RunRecord> rows = jdbcTemplate.query(
                SELECT_WITH_COUNTERS + " WHERE r.id = ? GROUP BY r.id",
                RUN_MAPPER,
                id
        );
        return rows.stream().findFirst();
    }

    public List<RunRecord> findActiveRuns(int limit) {
        return jdbcTemplate.query(
                SELECT_WITH_COUNTERS + """
                 WHERE r.status IN ('PENDING', 'RUNNING')
                 GROUP BY r.id
                 ORDER BY r.created_at ASC, r.id ASC
                 LIMIT ?
                """,
                RUN_MAPPER,
                limit
        );
    }

    public Optional<RunStatus> findStatus(long id) {
        List<String> rows = jdbcTemplate.queryForList("SELECT status FROM runs WHERE id = ?", String.class, id);
        return rows.stream().findFirst().map(RunStatus::valueOf);
    }

    public int countActiveWithScopeHash(String scopeHash) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM runs WHERE scope_hash = ? AND status IN ('PENDING', 'RUNNING')",
                Integer.class,
                scopeHash
        );
        return count == null ? 0 : count;
    }

    public boolean touchActive(long runId, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE runs SET updated_at = ? WHERE id = ? AND status IN ('PENDING', 'RUNNING')",
                SqlTime.toMillis(now),
                runId
        );
        return updated == 1;
    }

    public Optional<Integer> findItemLimit(long runId) {
        List<Integer> rows = jdbcTemplate.queryForList("SELECT item_limit FROM runs WHERE id = ?", Integer.class, runId);
        return rows.stream().findFirst();
    }

    public boolean markRunning(long runId, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE runs
                   SET status = 'RUNNING',
                       started_at = COALESCE(started_at, ?),
                       updated_at = ?
                 WHERE id = ? AND status = 'PENDING'
                """,
                SqlTime.toMillis(now),
                SqlTime.toMillis(now),
                runId
        );
        return updated == 1;
    }

    public void heartbeat(long runId, Instant now) {
        jdbcTemplate.update(
                "UPDATE runs SET heartbeat_at = ?, updated_at = ?, stale_flagged_at = NULL WHERE id = ?",
                SqlTime.toMillis(now),
                SqlTime.toMillis(now),
                runId
        );
    }

    public boolean halt(long runId, RunStatus status, String reason, Instant now) {
        if (status.isActive()) {
            throw new IllegalArgumentException("Halt status must be terminal: " + status);
        }
        int updated = jdbcTemplate.update(
                """
                UPDATE runs
                   SET status = ?,
                       last_error = COALESCE(?, last_error),
                       completed_at = ?,
                       updated_at = ?
                 WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """,
                status.name(),
                reason,
                SqlTime.toMillis(now),
                SqlTime.toMillis(now),
                runId
        );
        return updated == 1;
    }

    /**
     * Moves a running run to COMPLETED or FAILED once none of its items are queued or processing.
     * The failure ratio is failed / (completed + failed); skipped items do not count.
     */
    public boolean finishIfDrained(long runId, double failureRatioThreshold, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE runs
                   SET status = CASE
                           WHEN (SELECT COUNT(*) FROM run_items WHERE run_id = runs.id AND state = 'FAILED')
                                > ? * (SELECT COUNT(*) FROM run_items WHERE run_id = runs.id AND state IN ('COMPLETED', 'FAILED'))
                           THEN 'FAILED' ELSE 'COMPLETED' END,
                       last_error = CASE
                           WHEN (SELECT COUNT(*) FROM run_items WHERE run_id = runs.id AND state = 'FAILED')
                                > ? * (SELECT COUNT(*) FROM run_items WHERE run_id = runs.id AND state IN ('COMPLETED', 'FAILED'))
                           THEN 'Failure ratio exceeded threshold' ELSE last_error END,
                       completed_at = ?,
                       updated_at = ?
                 WHERE id = ?
                   AND status = 'RUNNING'
                   AND NOT EXISTS (
                       SELECT 1 FROM run_items WHERE run_id = runs.id AND state IN ('QUEUED', 'PROCESSING')
                   )
                """,
                failureRatioThreshold,
                failureRatioThreshold,
                SqlTime.toMillis(now),
                SqlTime.toMillis(now),
                runId
        );
        return updated == 1;
    }

    public int flagStaleRuns(Instant heartbeatCutoff, Instant now) {
        return jdbcTemplate.update(
                """
                UPDATE runs
                   SET stale_flagged_at = ?
                 WHERE status IN ('PENDING', 'RUNNING')
                   AND stale_flagged_at IS NULL
                   AND COALESCE(heartbeat_at, created_at) <= ?
                """,
                SqlTime.toMillis(now),
                SqlTime.toMillis(heartbeatCutoff)
        );
    }

    public List<Long> findFlaggedAt(Instant flaggedAt) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM runs WHERE stale_flagged_at = ? ORDER BY id",
                Long.class,
                SqlTime.toMillis(flaggedAt)
        );
    }
}
