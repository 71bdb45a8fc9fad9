package com.docsage.api.controller;

import com.docsage.api.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
    @JsonProperty("task_id") String taskId,
    String status,
    Object result
) {
    public static TaskStatusResponse from(TaskStatus status) {
        return new TaskStatusResponse(status.taskId(), status.status(), status.result());
    }
}
