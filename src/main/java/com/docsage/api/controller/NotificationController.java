package com.docsage.api.controller;

import com.docsage.api.exception.PayloadValidationException;
import com.docsage.api.model.NotificationRecord;
import com.docsage.api.service.CompletionWebhookService;
import com.docsage.api.service.LongPollReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Future;

@Slf4j
@RestController
public class NotificationController {

    private final LongPollReader longPollReader;
    private final CompletionWebhookService completionWebhookService;
    private final AsyncTaskExecutor pollTaskExecutor;

    public NotificationController(LongPollReader longPollReader,
                                  CompletionWebhookService completionWebhookService,
                                  @Qualifier("pollTaskExecutor") AsyncTaskExecutor pollTaskExecutor) {
        this.longPollReader = longPollReader;
        this.completionWebhookService = completionWebhookService;
        this.pollTaskExecutor = pollTaskExecutor;
    }

    /**
     * Long poll for notifications with an id greater than {@code since_id}.
     * An empty {@code messages} list means nothing arrived before the timeout.
     */
    @GetMapping("/poll")
    public DeferredResult<PollResponse> poll(
        @RequestParam(name = "since_id", defaultValue = "0") long sinceId,
        @RequestParam(name = "timeout", required = false) Double timeoutSeconds) {

        Duration requested = toDuration(timeoutSeconds);
        DeferredResult<PollResponse> deferred =
            new DeferredResult<>(longPollReader.requestDeadline().toMillis(), PollResponse::empty);

        Future<?> task;
        try {
            task = pollTaskExecutor.submit(() -> {
                try {
                    List<NotificationRecord> records = longPollReader.poll(sinceId, requested);
                    deferred.setResult(PollResponse.of(records));
                } catch (RuntimeException e) {
                    deferred.setErrorResult(e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Poll executor saturated, answering poll since {} with no news", sinceId);
            deferred.setResult(PollResponse.empty());
            return deferred;
        }

        deferred.onTimeout(() -> task.cancel(true));
        deferred.onError(error -> {
            log.debug("Poll since {} ended early: {}", sinceId, error.getMessage());
            task.cancel(true);
        });
        return deferred;
    }

    @GetMapping("/poll/cursor")
    public ResponseEntity<CursorResponse> cursor() {
        return ResponseEntity.ok(new CursorResponse(longPollReader.latestId()));
    }

    @PostMapping("/internal/notify")
    public ResponseEntity<NotifyResponse> notify(@RequestBody NotificationRequest request) {
        NotificationRecord record = completionWebhookService.complete(request.toPayload());
        return ResponseEntity.ok(NotifyResponse.ok(record.id()));
    }

    private static Duration toDuration(Double timeoutSeconds) {
        if (timeoutSeconds == null) {
            return null;
        }
        if (timeoutSeconds.isNaN() || timeoutSeconds.isInfinite()) {
            throw new PayloadValidationException("timeout must be a finite number of seconds");
        }
        if (timeoutSeconds <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.round(Math.min(timeoutSeconds, 3600d) * 1000));
    }
}
