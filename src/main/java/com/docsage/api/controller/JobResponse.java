package com.docsage.api.controller;

import com.docsage.api.model.JobReceipt;
import com.fasterxml.jackson.annotation.JsonProperty;

public record JobResponse(
    @JsonProperty("task_id") String taskId,
    String webhook
) {
    public static JobResponse from(JobReceipt receipt) {
        return new JobResponse(receipt.taskId(), receipt.webhookUrl());
    }
}
