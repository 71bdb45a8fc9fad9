package com.docsage.api.model;

public record JobReceipt(
    String taskId,
    String webhookUrl
) {}
