package com.docsage.api.service;

import com.docsage.api.exception.EntityNotFoundException;
import com.docsage.api.exception.UpstreamException;
import com.docsage.api.model.JobType;
import com.docsage.api.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.provider", havingValue = "http")
public class HttpJobSubmitter implements JobSubmitter {

    static final String QUEUE_UPSTREAM = "queue";

    record SubmitRequest(@JsonProperty("task_type") String taskType, Map<String, Object> payload) {}

    record SubmitResponse(@JsonProperty("task_id") String taskId) {}

    record StatusResponse(String status, Object result) {}

    private final RestClient queueRestClient;

    public HttpJobSubmitter(@Qualifier("queueRestClient") RestClient queueRestClient) {
        this.queueRestClient = queueRestClient;
    }

    @Override
    public String submit(JobType jobType, Map<String, Object> payload) {
        SubmitResponse response;
        try {
            response = queueRestClient.post()
                .uri("/queue/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new SubmitRequest(jobType.taskType(), payload))
                .retrieve()
                .body(SubmitResponse.class);
        } catch (RestClientException e) {
            log.error("Queue service submit failed for {}: {}", jobType.taskType(), e.getMessage(), e);
            throw new UpstreamException(QUEUE_UPSTREAM, "Failed to submit task to queue", e);
        }

        if (response == null || response.taskId() == null || response.taskId().isBlank()) {
            throw new UpstreamException(QUEUE_UPSTREAM, "Queue service returned no task id");
        }
        log.info("Submitted {} task {}", jobType.taskType(), response.taskId());
        return response.taskId();
    }

    @Override
    public TaskStatus status(String taskId) {
        StatusResponse response;
        try {
            response = queueRestClient.get()
                .uri("/queue/status/{taskId}", taskId)
                .retrieve()
                .body(StatusResponse.class);
        } catch (HttpClientErrorException.NotFound e) {
            throw EntityNotFoundException.task(taskId);
        } catch (RestClientException e) {
            log.error("Queue service status lookup failed for {}: {}", taskId, e.getMessage(), e);
            throw new UpstreamException(QUEUE_UPSTREAM, "Failed to get task status", e);
        }

        if (response == null) {
            throw new UpstreamException(QUEUE_UPSTREAM, "Queue service returned no status");
        }
        return new TaskStatus(taskId, response.status() == null ? "unknown" : response.status(), response.result());
    }
}
