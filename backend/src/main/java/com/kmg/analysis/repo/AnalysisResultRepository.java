package com.kmg.analysis.repo;

import com.kmg.analysis.model.AnalysisResultRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class AnalysisResultRepository {
    private final JdbcTemplate jdbcTemplate;

    public AnalysisResultRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<AnalysisResultRecord> MAPPER = new RowMapper<>() {
        @Override
        public AnalysisResultRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new AnalysisResultRecord(
                    rs.getLong("content_item_id"),
                    rs.getString("sentiment_json"),
                    rs.getString("impact_json"),
                    rs.getString("model_tag"),
                    rs.getInt("fallback") == 1,
                    SqlTime.read(rs, "updated_at")
            );
        }
    };

    public void upsert(long contentItemId, String sentimentJson, String impactJson, String modelTag,
                       boolean fallback, Instant now) {
        jdbcTemplate.update(
                """
                INSERT INTO analysis_results(content_item_id, sentiment_json, impact_json, model_tag, fallback, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(content_item_id) DO UPDATE SET
                    sentiment_json = excluded.sentiment_json,
                    impact_json = excluded.impact_json,
                    model_tag = excluded.model_tag,
                    fallback = excluded.fallback,
                    updated_at = excluded.updated_at
                """,
                contentItemId,
                sentimentJson,
                impactJson,
                modelTag,
                fallback ? 1 : 0,
                SqlTime.toMillis(now)
        );
    }

    public Optional<AnalysisResultRecord> findByContentItemId(long contentItemId) {
        List<AnalysisResultRecord> rows = jdbcTemplate.query(
                "SELECT * FROM analysis_results WHERE content_item_id = ?",
                MAPPER,
                contentItemId
        );
        return rows.stream().findFirst();
    }

    public int countByContentItemId(long contentItemId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM analysis_results WHERE content_item_id = ?",
                Integer.class,
                contentItemId
        );
        return count == null ? 0 : count;
    }
}
