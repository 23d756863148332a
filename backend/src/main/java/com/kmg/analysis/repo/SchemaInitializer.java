package com.kmg.analysis.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class SchemaInitializer {
    private final JdbcTemplate jdbcTemplate;

    public SchemaInitializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void initialize() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS content_items (
              id INTEGER PRIMARY KEY,
              title TEXT,
              summary TEXT,
              created_at INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS runs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              scope_json TEXT NOT NULL,
              scope_hash TEXT NOT NULL,
              model_tag TEXT NOT NULL,
              rate_per_second REAL,
              item_limit INTEGER NOT NULL,
              dry_run INTEGER NOT NULL DEFAULT 0,
              triggered_by TEXT,
              status TEXT NOT NULL,
              last_error TEXT,
              created_at INTEGER NOT NULL,
              updated_at INTEGER NOT NULL,
              started_at INTEGER,
              completed_at INTEGER,
              heartbeat_at INTEGER,
              stale_flagged_at INTEGER
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_runs_status ON runs(status, created_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_runs_scope_hash ON runs(scope_hash)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS run_items (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              run_id INTEGER NOT NULL,
              content_item_id INTEGER NOT NULL,
              state TEXT NOT NULL,
              created_at INTEGER NOT NULL,
              claimed_at INTEGER,
              claimed_by TEXT,
              claim_token TEXT,
              available_at INTEGER,
              completed_at INTEGER,
              attempt_count INTEGER NOT NULL DEFAULT 0,
              last_error_code TEXT,
              last_error_message TEXT,
              tokens_used INTEGER,
              cost_usd REAL,
              UNIQUE (run_id, content_item_id),
              FOREIGN KEY (run_id) REFERENCES runs(id)
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_run_items_queue ON run_items(run_id, state, id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_run_items_claimed ON run_items(state, claimed_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_run_items_token ON run_items(claim_token)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS analysis_results (
              content_item_id INTEGER PRIMARY KEY,
              sentiment_json TEXT NOT NULL,
              impact_json TEXT NOT NULL,
              model_tag TEXT,
              fallback INTEGER NOT NULL DEFAULT 0,
              updated_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS run_throttle (
              run_id INTEGER PRIMARY KEY,
              next_slot_at INTEGER NOT NULL
            )
            """);
    }
}
