package com.docsage.api.service;

import com.docsage.api.event.NotificationAppendedEvent;
import com.docsage.api.exception.PayloadValidationException;
import com.docsage.api.exception.PersistenceException;
import com.docsage.api.model.CompletionPayload;
import com.docsage.api.model.NotificationDraft;
import com.docsage.api.model.NotificationRecord;
import com.docsage.api.model.NotificationStatus;
import com.docsage.api.model.NotificationType;
import com.docsage.api.repository.NotificationLogRepository;
import com.docsage.api.repository.SummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handles job completion reports from the queue worker.
 *
 * <p>The summary upsert and the notification append run in one transaction,
 * so a poller can only see a "summary completed" notification once the summary
 * itself is committed. A worker retry with the same payload rewrites the same
 * summary and appends another notification; readers treat repeats as a
 * refresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionWebhookService {

    static final int MAX_FILENAME_LENGTH = 1024;

    private final SummaryRepository summaryRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public NotificationRecord complete(CompletionPayload payload) {
        NotificationDraft draft = validate(payload);

        try {
            if (draft.carriesSummary()) {
                summaryRepository.upsert(draft.filename(), draft.result());
                log.info("Summary stored for {}", draft.filename());
            }

            NotificationRecord appended = notificationLogRepository.append(draft);
            eventPublisher.publishEvent(new NotificationAppendedEvent(appended.id()));

            log.info("Notification {} appended: {} {} for {}",
                appended.id(), draft.type().wireName(), draft.status().wireName(), draft.filename());
            return appended;
        } catch (DataAccessException e) {
            log.error("Failed to persist completion of {} for {}: {}",
                draft.type().wireName(), draft.filename(), e.getMessage(), e);
            throw new PersistenceException("Failed to persist completion for " + draft.filename(), e);
        }
    }

    NotificationDraft validate(CompletionPayload payload) {
        if (payload == null) {
            throw new PayloadValidationException("Request body is required");
        }

        NotificationType type = NotificationType.fromWire(requireText(payload.type(), "type"))
            .orElseThrow(() -> new PayloadValidationException(
                "type must be one of: ingestion, summarization"));

        NotificationStatus status = NotificationStatus.fromWire(requireText(payload.status(), "status"))
            .orElseThrow(() -> new PayloadValidationException(
                "status must be one of: completed, failed"));

        String filename = requireText(payload.filename(), "filename").trim();
        if (filename.length() > MAX_FILENAME_LENGTH) {
            throw new PayloadValidationException("filename is too long");
        }
        if (filename.chars().anyMatch(Character::isISOControl)) {
            throw new PayloadValidationException("filename contains control characters");
        }

        boolean summaryCompleted = type == NotificationType.SUMMARIZATION && status == NotificationStatus.COMPLETED;
        if (summaryCompleted && isBlank(payload.result())) {
            throw new PayloadValidationException("result is required for a completed summarization");
        }

        String result = summaryCompleted ? payload.result() : null;
        String error = status == NotificationStatus.FAILED ? blankToNull(payload.error()) : null;

        return new NotificationDraft(type, filename, status, result, error);
    }

    private static String requireText(String value, String field) {
        if (isBlank(value)) {
            throw new PayloadValidationException(field + " is required");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
