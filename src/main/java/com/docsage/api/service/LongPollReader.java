package com.docsage.api.service;

import com.docsage.api.config.PollProperties;
import com.docsage.api.exception.PersistenceException;
import com.docsage.api.infra.AppendSignal;
import com.docsage.api.model.NotificationRecord;
import com.docsage.api.repository.NotificationLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Cursor-based long poll over the notification log.
 *
 * <p>Returns at once when records past the cursor exist. Otherwise waits in
 * short slices, re-reading the log after each one, until something shows up or
 * the effective timeout runs out. An empty result is a normal answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LongPollReader {

    private final NotificationLogRepository notificationLogRepository;
    private final AppendSignal appendSignal;
    private final PollProperties properties;

    public List<NotificationRecord> poll(long sinceId, Duration requestedTimeout) {
        long cursor = Math.max(sinceId, 0L);
        Duration timeout = effectiveTimeout(requestedTimeout);
        long deadline = System.nanoTime() + timeout.toNanos();

        long generation = appendSignal.generation();
        List<NotificationRecord> records = read(cursor);

        while (records.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            long slice = Math.min(remaining, properties.recheckInterval().toNanos());
            try {
                appendSignal.awaitChange(generation, slice, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Poll since {} abandoned", cursor);
                return List.of();
            }
            generation = appendSignal.generation();
            records = read(cursor);
        }

        return records;
    }

    public long latestId() {
        try {
            return notificationLogRepository.latestId();
        } catch (DataAccessException e) {
            log.error("Failed to read notification cursor: {}", e.getMessage(), e);
            throw new PersistenceException("Failed to read notification cursor", e);
        }
    }

    /**
     * Upper bound for the whole HTTP exchange, used as the async request timeout.
     */
    public Duration requestDeadline() {
        return properties.maxRequestDuration();
    }

    Duration effectiveTimeout(Duration requested) {
        Duration timeout = requested == null ? properties.defaultTimeout() : requested;
        Duration platformLimit = properties.maxRequestDuration().minus(properties.responseMargin());

        timeout = min(timeout, properties.maxTimeout());
        timeout = min(timeout, platformLimit);
        return timeout.isNegative() ? Duration.ZERO : timeout;
    }

    private List<NotificationRecord> read(long cursor) {
        try {
            return notificationLogRepository.readSince(cursor, properties.maxBatch());
        } catch (DataAccessException e) {
            log.error("Failed to read notifications since {}: {}", cursor, e.getMessage(), e);
            throw new PersistenceException("Failed to read notifications", e);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
