package com.docsage.api.listener;

import com.docsage.api.event.NotificationAppendedEvent;
import com.docsage.api.infra.AppendSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationEventListener {

    private final AppendSignal appendSignal;

    // Only after commit: a woken poller must be able to read the record.
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleAppended(NotificationAppendedEvent event) {
        log.debug("Waking pollers for notification {}", event.notificationId());
        appendSignal.signal();
    }
}
