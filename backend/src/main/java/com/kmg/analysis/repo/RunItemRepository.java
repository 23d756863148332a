package com.kmg.analysis.repo;

import com.kmg.analysis.model.DeferredStats;
import com.kmg.analysis.model.RunItemRecord;
import com.kmg.analysis.model.RunItemState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work item queue backed by the {@code run_items} table.
 *
 * <p>Every mutation of a claimed row is conditioned on {@code state = 'PROCESSING'} and the claim token
 * handed out by {@link #claim}, so a worker whose claim was reclaimed can no longer write to the row.</p>
 */
@Repository
public class RunItemRepository {
    private static final String RUN_ACTIVE = "(SELECT r.status FROM runs r WHERE r.id = run_items.run_id) IN ('PENDING', 'RUNNING')";

    private static final String HALT_CODE = """
            (SELECT CASE r.status WHEN 'CANCELLED' THEN 'CANCELLED' ELSE 'RUN_FAILED' END
               FROM runs r WHERE r.id = run_items.run_id)""";

    private final JdbcTemplate jdbcTemplate;

    public RunItemRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<RunItemRecord> ITEM_MAPPER = new RowMapper<>() {
        @Override
        public RunItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            int tokens = rs.getInt("tokens_used");
            Integer tokensUsed = rs.wasNull() ? null : tokens;
            double cost = rs.getDouble("cost_usd");
            Double costUsd = rs.wasNull() ? null : cost;
            return new RunItemRecord(
                    rs.getLong("id"),
                    rs.getLong("run_id"),
                    rs.getLong("content_item_id"),
                    RunItemState.valueOf(rs.getString("state")),
                    SqlTime.read(rs, "created_at"),
                    SqlTime.read(rs, "claimed_at"),
                    rs.getString("claimed_by"),
                    rs.getString("claim_token"),
                    SqlTime.read(rs, "available_at"),
                    SqlTime.read(rs, "completed_at"),
                    rs.getInt("attempt_count"),
                    rs.getString("last_error_code"),
                    rs.getString("last_error_message"),
                    tokensUsed,
                    costUsd
            );
        }
    };

    public int insertQueued(long runId, List<Long> contentItemIds, Instant now) {
        if (contentItemIds.isEmpty()) {
            return 0;
        }
        List<Object[]> batch = new ArrayList<>(contentItemIds.size());
        for (Long contentItemId : contentItemIds) {
            batch.add(new Object[]{runId, contentItemId, SqlTime.toMillis(now)});
        }
        int[] counts = jdbcTemplate.batchUpdate(
                """
                INSERT INTO run_items(run_id, content_item_id, state, created_at, attempt_count)
                VALUES (?, ?, 'QUEUED', ?, 0)
                ON CONFLICT(run_id, content_item_id) DO NOTHING
                """,
                batch
        );
        int inserted = 0;
        for (int count : counts) {
            if (count > 0) {
                inserted += count;
            }
        }
        return inserted;
    }

    public int countByRunId(long runId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM run_items WHERE run_id = ?",
                Integer.class,
                runId
        );
        return count == null ? 0 : count;
    }

    public List<Long> findContentItemIds(long runId) {
        return jdbcTemplate.queryForList(
                "SELECT content_item_id FROM run_items WHERE run_id = ?",
                Long.class,
                runId
        );
    }

    public int claim(long runId, int batchSize, String workerId, String claimToken, Instant now) {
        return jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = 'PROCESSING',
                       claimed_at = ?,
                       claimed_by = ?,
                       claim_token = ?
                 WHERE id IN (
                       SELECT i.id
                         FROM run_items i
                        WHERE i.run_id = ?
                          AND i.state = 'QUEUED'
                          AND (i.available_at IS NULL OR i.available_at <= ?)
                          AND EXISTS (SELECT 1 FROM runs r WHERE r.id = i.run_id AND r.status IN ('PENDING', 'RUNNING'))
                        ORDER BY i.id ASC
                        LIMIT ?
                       )
                   AND state = 'QUEUED'
                """,
                SqlTime.toMillis(now),
                workerId,
                claimToken,
                runId,
                SqlTime.toMillis(now),
                batchSize
        );
    }

    /**
     * Restarts the processing clock of every row still held under {@code claimToken}, so items waiting
     * behind others in the same batch are not mistaken for abandoned ones.
     */
    public int touchClaims(String claimToken, Instant now) {
        return jdbcTemplate.update(
                "UPDATE run_items SET claimed_at = ? WHERE claim_token = ? AND state = 'PROCESSING'",
                SqlTime.toMillis(now),
                claimToken
        );
    }

    public List<RunItemRecord> findByClaimToken(String claimToken) {
        return jdbcTemplate.query(
                "SELECT * FROM run_items WHERE claim_token = ? ORDER BY id ASC",
                ITEM_MAPPER,
                claimToken
        );
    }

    public Optional<RunItemRecord> findById(long id) {
        List<RunItemRecord> rows = jdbcTemplate.query("SELECT * FROM run_items WHERE id = ?", ITEM_MAPPER, id);
        return rows.stream().findFirst();
    }

    public List<RunItemRecord> findByRunId(long runId) {
        return jdbcTemplate.query(
                "SELECT * FROM run_items WHERE run_id = ? ORDER BY id ASC",
                ITEM_MAPPER,
                runId
        );
    }

    public boolean complete(long itemId, String claimToken, int attemptCount, Integer tokensUsed, Double costUsd,
                            String errorCode, String errorMessage, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = 'COMPLETED',
                       completed_at = ?,
                       attempt_count = ?,
                       tokens_used = ?,
                       cost_usd = ?,
                       last_error_code = ?,
                       last_error_message = ?,
                       claim_token = NULL
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """,
                SqlTime.toMillis(now),
                attemptCount,
                tokensUsed,
                costUsd,
                errorCode,
                errorMessage,
                itemId,
                claimToken
        );
        return updated == 1;
    }

    public boolean fail(long itemId, String claimToken, String errorCode, String errorMessage, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = 'FAILED',
                       completed_at = ?,
                       attempt_count = attempt_count + 1,
                       last_error_code = ?,
                       last_error_message = ?,
                       claim_token = NULL
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """,
                SqlTime.toMillis(now),
                errorCode,
                errorMessage,
                itemId,
                claimToken
        );
        return updated == 1;
    }

    public boolean defer(long itemId, String claimToken, Instant availableAt, String errorCode, String errorMessage,
                         Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = CASE WHEN %1$s THEN 'QUEUED' ELSE 'SKIPPED' END,
                       completed_at = CASE WHEN %1$s THEN NULL ELSE ? END,
                       attempt_count = attempt_count + 1,
                       available_at = ?,
                       claimed_at = NULL,
                       claim_token = NULL,
                       last_error_code = ?,
                       last_error_message = ?
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """.formatted(RUN_ACTIVE),
                SqlTime.toMillis(now),
                SqlTime.toMillis(availableAt),
                errorCode,
                errorMessage,
                itemId,
                claimToken
        );
        return updated == 1;
    }

    /**
     * Hands an unprocessed claim back to the queue without counting an attempt. On a cancelled or
     * failed run the item is skipped with the same code the run's queued items received.
     */
    public boolean releaseClaim(long itemId, String claimToken, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = CASE WHEN %1$s THEN 'QUEUED' ELSE 'SKIPPED' END,
                       completed_at = CASE WHEN %1$s THEN NULL ELSE ? END,
                       last_error_code = CASE WHEN %1$s THEN last_error_code ELSE %2$s END,
                       claimed_at = NULL,
                       claim_token = NULL
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """.formatted(RUN_ACTIVE, HALT_CODE),
                SqlTime.toMillis(now),
                itemId,
                claimToken
        );
        return updated == 1;
    }

    public int skipQueued(long runId, String reasonCode, Instant now) {
        return jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = 'SKIPPED',
                       completed_at = ?,
                       available_at = NULL,
                       last_error_code = ?
                 WHERE run_id = ? AND state = 'QUEUED'
                """,
                SqlTime.toMillis(now),
                reasonCode,
                runId
        );
    }

    public int reclaimStale(Instant claimedCutoff, Instant now) {
        return jdbcTemplate.update(
                """
                UPDATE run_items
                   SET state = CASE WHEN %1$s THEN 'QUEUED' ELSE 'SKIPPED' END,
                       completed_at = CASE WHEN %1$s THEN NULL ELSE ? END,
                       claimed_at = NULL,
                       claim_token = NULL,
                       available_at = NULL,
                       last_error_code = 'STALE_RECLAIMED'
                 WHERE state = 'PROCESSING' AND claimed_at <= ?
                """.formatted(RUN_ACTIVE),
                SqlTime.toMillis(now),
                SqlTime.toMillis(claimedCutoff)
        );
    }

    public DeferredStats deferredStats(Long runId, Instant now) {
        String runFilter = runId == null ? "" : " AND run_id = ?";
        List<Object> args = new ArrayList<>();
        args.add(SqlTime.toMillis(now));
        args.add(SqlTime.toMillis(now));
        if (runId != null) {
            args.add(runId);
        }

        DeferredStats totals = jdbcTemplate.queryForObject(
                """
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN available_at IS NULL OR available_at <= ? THEN 1 ELSE 0 END), 0) AS ready,
                       MIN(CASE WHEN available_at > ? THEN available_at END) AS next_at,
                       COALESCE(MAX(attempt_count), 0) AS max_attempts
                  FROM run_items
                 WHERE state = 'QUEUED' AND attempt_count > 0
                """ + runFilter,
                (rs, rowNum) -> {
                    long total = rs.getLong("total");
                    long ready = rs.getLong("ready");
                    return new DeferredStats(
                            total,
                            ready,
                            total - ready,
                            SqlTime.read(rs, "next_at"),
                            rs.getInt("max_attempts"),
                            Map.of()
                    );
                },
                args.toArray()
        );

        Map<String, Long> byCode = new LinkedHashMap<>();
        jdbcTemplate.query(
                """
                SELECT COALESCE(last_error_code, 'NONE') AS code, COUNT(*) AS n
                  FROM run_items
                 WHERE state = 'QUEUED' AND attempt_count > 0
                """ + runFilter + " GROUP BY code ORDER BY code",
                (RowCallbackHandler) rs -> byCode.put(rs.getString("code"), rs.getLong("n")),
                runId == null ? new Object[0] : new Object[]{runId}
        );

        if (totals == null) {
            return new DeferredStats(0, 0, 0, null, 0, byCode);
        }
        return new DeferredStats(
                totals.deferredTotal(),
                totals.readyNow(),
                totals.waiting(),
                totals.nextAvailableAt(),
                totals.maxAttemptCount(),
                byCode
        );
    }
}
