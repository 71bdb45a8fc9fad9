package com.docsage.api.repository;

import com.docsage.api.model.NotificationDraft;
import com.docsage.api.model.NotificationRecord;
import com.docsage.api.model.NotificationStatus;
import com.docsage.api.model.NotificationType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationLogRepository implements NotificationLogRepository {

    static final String CURSOR_NAME = "notifications";

    private final JdbcClient jdbcClient;

    private final RowMapper<NotificationRecord> notificationRowMapper = (rs, rowNum) -> new NotificationRecord(
        rs.getLong("id"),
        NotificationType.fromWire(rs.getString("type")).orElseThrow(),
        rs.getString("filename"),
        NotificationStatus.fromWire(rs.getString("status")).orElseThrow(),
        rs.getString("result"),
        rs.getString("error"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    /**
     * Takes the next cursor from the counter row and inserts the record in the
     * caller's transaction. The counter row stays locked until that transaction
     * ends, so a later id can never commit before an earlier one.
     */
    @Override
    @Transactional
    public NotificationRecord append(NotificationDraft draft) {
        long id = jdbcClient.sql("""
                UPDATE notification_cursor
                SET last_id = last_id + 1
                WHERE name = :name
                RETURNING last_id
                """)
            .param("name", CURSOR_NAME)
            .query(Long.class)
            .single();

        return jdbcClient.sql("""
                INSERT INTO notifications (id, type, filename, status, result, error, created_at)
                VALUES (:id, :type, :filename, :status, :result, :error, clock_timestamp())
                RETURNING *
                """)
            .param("id", id)
            .param("type", draft.type().wireName())
            .param("filename", draft.filename())
            .param("status", draft.status().wireName())
            .param("result", draft.result())
            .param("error", draft.error())
            .query(notificationRowMapper)
            .single();
    }

    @Override
    public List<NotificationRecord> readSince(long cursorExclusive) {
        return jdbcClient.sql("""
                SELECT * FROM notifications
                WHERE id > :cursor
                ORDER BY id ASC
                """)
            .param("cursor", cursorExclusive)
            .query(notificationRowMapper)
            .list();
    }

    @Override
    public List<NotificationRecord> readSince(long cursorExclusive, int limit) {
        return jdbcClient.sql("""
                SELECT * FROM notifications
                WHERE id > :cursor
                ORDER BY id ASC
                LIMIT :limit
                """)
            .param("cursor", cursorExclusive)
            .param("limit", limit)
            .query(notificationRowMapper)
            .list();
    }

    @Override
    public long latestId() {
        return jdbcClient.sql("SELECT last_id FROM notification_cursor WHERE name = :name")
            .param("name", CURSOR_NAME)
            .query(Long.class)
            .optional()
            .orElse(0L);
    }
}
