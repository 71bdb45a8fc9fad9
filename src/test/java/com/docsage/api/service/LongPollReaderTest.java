package com.docsage.api.service;

import com.docsage.api.config.PollProperties;
import com.docsage.api.exception.PersistenceException;
import com.docsage.api.infra.AppendSignal;
import com.docsage.api.model.NotificationRecord;
import com.docsage.api.model.NotificationStatus;
import com.docsage.api.model.NotificationType;
import com.docsage.api.repository.NotificationLogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LongPollReaderTest {

    private static final int MAX_BATCH = 100;

    private final NotificationLogRepository repository = Mockito.mock(NotificationLogRepository.class);
    private final AppendSignal appendSignal = new AppendSignal();

    private LongPollReader reader(Duration recheckInterval) {
        PollProperties properties = new PollProperties(
            Duration.ofSeconds(20),
            Duration.ofSeconds(25),
            Duration.ofSeconds(28),
            Duration.ofSeconds(2),
            recheckInterval,
            MAX_BATCH,
            10
        );
        return new LongPollReader(repository, appendSignal, properties);
    }

    @Test
    @DisplayName("Returns at once when records past the cursor exist")
    void shouldReturnImmediatelyWhenDataExists() {
        NotificationRecord record = record(6);
        when(repository.readSince(5L, MAX_BATCH)).thenReturn(List.of(record));

        long started = System.nanoTime();
        List<NotificationRecord> result = reader(Duration.ofSeconds(1)).poll(5, Duration.ofSeconds(10));

        assertThat(result).containsExactly(record);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(1000);
        verify(repository, times(1)).readSince(anyLong(), anyInt());
    }

    @Test
    @DisplayName("Waits for about the timeout and re-reads the log on every slice")
    void shouldWaitUntilTimeoutWhenNothingArrives() {
        when(repository.readSince(3L, MAX_BATCH)).thenReturn(List.of());

        long started = System.nanoTime();
        List<NotificationRecord> result = reader(Duration.ofMillis(50)).poll(3, Duration.ofMillis(300));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(result).isEmpty();
        assertThat(elapsed).isGreaterThanOrEqualTo(250);
        verify(repository, atLeast(3)).readSince(3L, MAX_BATCH);
    }

    @Test
    @DisplayName("Picks up a record appended by another instance on the next re-check")
    void shouldSeeRecordOnRecheck() {
        AtomicBoolean appended = new AtomicBoolean(false);
        when(repository.readSince(0L, MAX_BATCH))
            .thenAnswer(inv -> appended.get() ? List.of(record(1)) : List.of());

        CompletableFuture<List<NotificationRecord>> poll = CompletableFuture.supplyAsync(() ->
            reader(Duration.ofMillis(50)).poll(0, Duration.ofSeconds(10)));

        appended.set(true);

        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
            assertThat(poll).isCompletedWithValueMatching(records -> records.size() == 1));
    }

    @Test
    @DisplayName("Wakes early when a local append is signalled")
    void shouldWakeOnSignal() {
        AtomicBoolean appended = new AtomicBoolean(false);
        when(repository.readSince(0L, MAX_BATCH))
            .thenAnswer(inv -> appended.get() ? List.of(record(1)) : List.of());

        LongPollReader reader = reader(Duration.ofSeconds(10));
        long started = System.nanoTime();
        CompletableFuture<List<NotificationRecord>> poll = CompletableFuture.supplyAsync(() ->
            reader.poll(0, Duration.ofSeconds(10)));

        await().pollDelay(100, TimeUnit.MILLISECONDS).until(() -> true);
        appended.set(true);
        appendSignal.signal();

        await().atMost(2, TimeUnit.SECONDS).until(poll::isDone);
        assertThat(poll.join()).hasSize(1);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5000);
    }

    @Test
    @DisplayName("Negative cursor reads from the start of the log")
    void shouldTreatNegativeCursorAsZero() {
        when(repository.readSince(0L, MAX_BATCH)).thenReturn(List.of(record(1)));

        assertThat(reader(Duration.ofSeconds(1)).poll(-42, Duration.ofSeconds(1))).hasSize(1);
        verify(repository).readSince(eq(0L), eq(MAX_BATCH));
    }

    @Test
    @DisplayName("An interrupted wait returns an empty result and keeps the interrupt flag")
    void shouldReturnEmptyWhenInterrupted() throws Exception {
        when(repository.readSince(0L, MAX_BATCH)).thenReturn(List.of());
        AtomicReference<List<NotificationRecord>> result = new AtomicReference<>();
        AtomicBoolean interruptedAfter = new AtomicBoolean();

        Thread poller = new Thread(() -> {
            result.set(reader(Duration.ofSeconds(10)).poll(0, Duration.ofSeconds(10)));
            interruptedAfter.set(Thread.currentThread().isInterrupted());
        });
        poller.start();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> verify(repository).readSince(0L, MAX_BATCH));
        poller.interrupt();
        poller.join(2000);

        assertThat(poller.isAlive()).isFalse();
        assertThat(result.get()).isEmpty();
        assertThat(interruptedAfter.get()).isTrue();
    }

    @Test
    @DisplayName("A failing read surfaces as PersistenceException")
    void shouldWrapReadFailure() {
        when(repository.readSince(0L, MAX_BATCH)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> reader(Duration.ofSeconds(1)).poll(0, Duration.ofSeconds(1)))
            .isInstanceOf(PersistenceException.class);
    }

    @Nested
    @DisplayName("Effective timeout")
    class EffectiveTimeoutTest {

        @Test
        @DisplayName("Uses the default when none is requested")
        void shouldUseDefault() {
            assertThat(reader(Duration.ofSeconds(1)).effectiveTimeout(null)).isEqualTo(Duration.ofSeconds(20));
        }

        @Test
        @DisplayName("Caps the requested timeout at the configured maximum")
        void shouldCapAtMax() {
            assertThat(reader(Duration.ofSeconds(1)).effectiveTimeout(Duration.ofSeconds(60)))
                .isEqualTo(Duration.ofSeconds(25));
        }

        @Test
        @DisplayName("Keeps the request deadline minus the margin as the hard limit")
        void shouldClampToRequestDeadline() {
            PollProperties tight = new PollProperties(Duration.ofSeconds(20), Duration.ofSeconds(25),
                Duration.ofSeconds(10), Duration.ofSeconds(2), Duration.ofSeconds(1), MAX_BATCH, 10);
            LongPollReader reader = new LongPollReader(repository, appendSignal, tight);

            assertThat(reader.effectiveTimeout(Duration.ofSeconds(20))).isEqualTo(Duration.ofSeconds(8));
            assertThat(reader.effectiveTimeout(Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("Never goes negative")
        void shouldNeverBeNegative() {
            PollProperties broken = new PollProperties(Duration.ofSeconds(20), Duration.ofSeconds(25),
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1), MAX_BATCH, 10);
            LongPollReader reader = new LongPollReader(repository, appendSignal, broken);

            assertThat(reader.effectiveTimeout(Duration.ofSeconds(5))).isEqualTo(Duration.ZERO);
            assertThat(reader.poll(0, Duration.ofSeconds(5))).isEmpty();
        }
    }

    private static NotificationRecord record(long id) {
        return new NotificationRecord(id, NotificationType.INGESTION, "doc-" + id + ".pdf",
            NotificationStatus.COMPLETED, null, null, OffsetDateTime.now());
    }
}
