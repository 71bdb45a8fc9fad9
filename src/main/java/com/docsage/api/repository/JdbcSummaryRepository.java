package com.docsage.api.repository;

import com.docsage.api.model.SummaryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcSummaryRepository implements SummaryRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<SummaryRecord> summaryRowMapper = (rs, rowNum) -> new SummaryRecord(
        rs.getString("filename"),
        rs.getString("summary_text"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    // ON CONFLICT takes the row lock, so concurrent writers for one filename
    // serialize and the last commit wins; other filenames are untouched.
    @Override
    @Transactional
    public SummaryRecord upsert(String filename, String summary) {
        SummaryRecord saved = jdbcClient.sql("""
                INSERT INTO summaries (filename, summary_text, created_at)
                VALUES (:filename, :summary, clock_timestamp())
                ON CONFLICT (filename) DO UPDATE
                SET summary_text = EXCLUDED.summary_text,
                    created_at = EXCLUDED.created_at
                RETURNING filename, summary_text, created_at
                """)
            .param("filename", filename)
            .param("summary", summary)
            .query(summaryRowMapper)
            .single();

        jdbcClient.sql("""
                INSERT INTO summary_history (filename, summary_text, created_at)
                VALUES (:filename, :summary, :createdAt)
                """)
            .param("filename", saved.filename())
            .param("summary", saved.summary())
            .param("createdAt", saved.createdAt())
            .update();

        return saved;
    }

    @Override
    public Optional<SummaryRecord> findByFilename(String filename) {
        return jdbcClient.sql("SELECT * FROM summaries WHERE filename = :filename")
            .param("filename", filename)
            .query(summaryRowMapper)
            .optional();
    }

    @Override
    public List<SummaryRecord> findAll() {
        return jdbcClient.sql("SELECT * FROM summaries ORDER BY created_at DESC, filename ASC")
            .query(summaryRowMapper)
            .list();
    }

    @Override
    public List<SummaryRecord> findHistory(String filename) {
        return jdbcClient.sql("""
                SELECT filename, summary_text, created_at
                FROM summary_history
                WHERE filename = :filename
                ORDER BY id DESC
                """)
            .param("filename", filename)
            .query(summaryRowMapper)
            .list();
    }

    @Override
    @Transactional
    public int deleteByFilename(String filename) {
        jdbcClient.sql("DELETE FROM summary_history WHERE filename = :filename")
            .param("filename", filename)
            .update();

        return jdbcClient.sql("DELETE FROM summaries WHERE filename = :filename")
            .param("filename", filename)
            .update();
    }
}
