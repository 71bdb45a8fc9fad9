package com.docsage.api.service;

import com.docsage.api.config.QueueProperties;
import com.docsage.api.exception.PayloadValidationException;
import com.docsage.api.model.JobReceipt;
import com.docsage.api.model.JobType;
import com.docsage.api.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    static final String DEFAULT_DOCUMENT_SET = "all";

    private final JobSubmitter jobSubmitter;
    private final QueueProperties queueProperties;

    public JobReceipt submitSummarization(String filename) {
        Map<String, Object> payload = basePayload(filename);
        return submit(JobType.SUMMARIZE, payload);
    }

    public JobReceipt submitIngestion(String filename, String documentSet) {
        Map<String, Object> payload = basePayload(filename);
        payload.put("document_set", normalizeDocumentSet(documentSet));
        return submit(JobType.INGEST, payload);
    }

    public TaskStatus taskStatus(String taskId) {
        return jobSubmitter.status(taskId);
    }

    private JobReceipt submit(JobType jobType, Map<String, Object> payload) {
        String taskId = jobSubmitter.submit(jobType, payload);
        log.info("Queued {} for {} as task {}", jobType.taskType(), payload.get("filename"), taskId);
        return new JobReceipt(taskId, queueProperties.webhookUrl());
    }

    private Map<String, Object> basePayload(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new PayloadValidationException("filename is required");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("filename", filename.trim());
        payload.put("webhook_url", queueProperties.webhookUrl());
        return payload;
    }

    static String normalizeDocumentSet(String documentSet) {
        if (documentSet == null || documentSet.isBlank()) {
            return DEFAULT_DOCUMENT_SET;
        }
        String normalized = documentSet.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        return normalized.isEmpty() ? DEFAULT_DOCUMENT_SET : normalized;
    }
}
