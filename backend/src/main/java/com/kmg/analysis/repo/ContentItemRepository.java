package com.kmg.analysis.repo;

import com.kmg.analysis.model.ContentItem;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ContentItemRepository {
    private final JdbcTemplate jdbcTemplate;

    public ContentItemRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ContentItem> MAPPER = (rs, rowNum) -> new ContentItem(
            rs.getLong("id"),
            rs.getString("title"),
            rs.getString("summary")
    );

    public Optional<ContentItem> findById(long id) {
        List<ContentItem> rows = jdbcTemplate.query(
                "SELECT id, title, summary FROM content_items WHERE id = ?",
                MAPPER,
                id
        );
        return rows.stream().findFirst();
    }

    public void upsert(ContentItem item, Instant now) {
        jdbcTemplate.update(
                """
                INSERT INTO content_items(id, title, summary, created_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET title = excluded.title, summary = excluded.summary
                """,
                item.id(),
                item.title(),
                item.summary(),
                SqlTime.toMillis(now)
        );
    }
}
