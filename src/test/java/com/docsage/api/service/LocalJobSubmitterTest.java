package com.docsage.api.service;

import com.docsage.api.exception.EntityNotFoundException;
import com.docsage.api.model.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalJobSubmitterTest {

    private final LocalJobSubmitter submitter = new LocalJobSubmitter();

    @Test
    @DisplayName("Issues distinct task ids and reports them as pending")
    void shouldTrackSubmittedTasks() {
        String first = submitter.submit(JobType.INGEST, Map.of("filename", "a.pdf"));
        String second = submitter.submit(JobType.SUMMARIZE, Map.of("filename", "a.pdf"));

        assertThat(first).isEqualTo("local-task-1");
        assertThat(second).isEqualTo("local-task-2");
        assertThat(submitter.status(first).status()).isEqualTo(LocalJobSubmitter.PENDING);
    }

    @Test
    @DisplayName("Unknown task ids are not found")
    void shouldRejectUnknownTask() {
        assertThatThrownBy(() -> submitter.status("local-task-99"))
            .isInstanceOf(EntityNotFoundException.class);
    }
}
