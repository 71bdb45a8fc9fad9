package com.docsage.api.service;

import com.docsage.api.exception.EntityNotFoundException;
import com.docsage.api.model.JobType;
import com.docsage.api.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Development stand-in for the queue service. Records submissions in memory;
 * nothing executes them, completions are posted to the webhook by hand.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.provider", havingValue = "local", matchIfMissing = true)
public class LocalJobSubmitter implements JobSubmitter {

    static final String PENDING = "pending";

    private final AtomicLong counter = new AtomicLong();
    private final Map<String, TaskStatus> tasks = new ConcurrentHashMap<>();

    @Override
    public String submit(JobType jobType, Map<String, Object> payload) {
        String taskId = "local-task-" + counter.incrementAndGet();
        tasks.put(taskId, new TaskStatus(taskId, PENDING, null));
        log.info("Local queue accepted {} task {} with payload {}", jobType.taskType(), taskId, payload);
        return taskId;
    }

    @Override
    public TaskStatus status(String taskId) {
        TaskStatus status = tasks.get(taskId);
        if (status == null) {
            throw EntityNotFoundException.task(taskId);
        }
        return status;
    }
}
