package com.docsage.api.service;

import com.docsage.api.model.JobType;
import com.docsage.api.model.TaskStatus;

import java.util.Map;

/**
 * Enqueues work with the external task queue. Submission is fire-and-forget:
 * the result comes back later through the completion webhook.
 */
public interface JobSubmitter {
    String submit(JobType jobType, Map<String, Object> payload);
    TaskStatus status(String taskId);
}
