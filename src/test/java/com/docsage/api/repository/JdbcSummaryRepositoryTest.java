package com.docsage.api.repository;

import com.docsage.api.model.SummaryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcSummaryRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private SummaryRepository summaryRepository;

    @Autowired
    private JdbcClient jdbcClient;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM summary_history").update();
        jdbcClient.sql("DELETE FROM summaries").update();
    }

    @Nested
    @DisplayName("Upsert")
    class UpsertTest {

        @Test
        @DisplayName("Should store a summary and find it by filename")
        void shouldStoreAndFind() {
            SummaryRecord saved = summaryRepository.upsert("report.pdf", "Quarterly numbers went up.");

            assertThat(saved.filename()).isEqualTo("report.pdf");
            assertThat(saved.createdAt()).isNotNull();
            assertThat(summaryRepository.findByFilename("report.pdf"))
                .get()
                .extracting(SummaryRecord::summary)
                .isEqualTo("Quarterly numbers went up.");
        }

        @Test
        @DisplayName("Repeating the same write leaves one row with the same value")
        void shouldBeIdempotent() {
            summaryRepository.upsert("report.pdf", "Same text");
            summaryRepository.upsert("report.pdf", "Same text");

            assertThat(summaryRepository.findAll()).hasSize(1);
            assertThat(summaryRepository.findByFilename("report.pdf")).get()
                .extracting(SummaryRecord::summary).isEqualTo("Same text");
        }

        @Test
        @DisplayName("The last write for a filename wins and every write lands in history")
        void shouldKeepLastWriteAndHistory() {
            summaryRepository.upsert("report.pdf", "first");
            summaryRepository.upsert("report.pdf", "second");

            assertThat(summaryRepository.findByFilename("report.pdf")).get()
                .extracting(SummaryRecord::summary).isEqualTo("second");
            assertThat(summaryRepository.findHistory("report.pdf"))
                .extracting(SummaryRecord::summary)
                .containsExactly("second", "first");
        }

        @Test
        @DisplayName("Concurrent writes for one filename settle on one of the written values")
        void shouldSerializeConcurrentWrites() throws Exception {
            int writers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String text = "version-" + i;
                futures.add(CompletableFuture.runAsync(() -> summaryRepository.upsert("shared.pdf", text), executor));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(30, TimeUnit.SECONDS);
            executor.shutdown();

            List<SummaryRecord> history = summaryRepository.findHistory("shared.pdf");
            assertThat(history).hasSize(writers);
            assertThat(summaryRepository.findAll()).hasSize(1);
            assertThat(summaryRepository.findByFilename("shared.pdf")).get()
                .extracting(SummaryRecord::summary)
                .isEqualTo(history.get(0).summary());
        }
    }

    @Test
    @DisplayName("Missing filename is an empty result, not an error")
    void shouldReturnEmptyForMissing() {
        assertThat(summaryRepository.findByFilename("nope.pdf")).isEmpty();
        assertThat(summaryRepository.findHistory("nope.pdf")).isEmpty();
    }

    @Test
    @DisplayName("findAll lists the newest summary first")
    void shouldListNewestFirst() {
        summaryRepository.upsert("old.pdf", "old");
        summaryRepository.upsert("new.pdf", "new");

        assertThat(summaryRepository.findAll())
            .extracting(SummaryRecord::filename)
            .containsExactly("new.pdf", "old.pdf");
    }

    @Test
    @DisplayName("Delete removes the summary and its history")
    void shouldDeleteWithHistory() {
        summaryRepository.upsert("gone.pdf", "v1");
        summaryRepository.upsert("gone.pdf", "v2");
        summaryRepository.upsert("kept.pdf", "stays");

        assertThat(summaryRepository.deleteByFilename("gone.pdf")).isEqualTo(1);
        assertThat(summaryRepository.deleteByFilename("gone.pdf")).isZero();

        assertThat(summaryRepository.findByFilename("gone.pdf")).isEmpty();
        assertThat(summaryRepository.findHistory("gone.pdf")).isEmpty();
        assertThat(summaryRepository.findByFilename("kept.pdf")).isPresent();
    }
}
