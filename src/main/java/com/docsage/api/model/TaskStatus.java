package com.docsage.api.model;

public record TaskStatus(
    String taskId,
    String status,
    Object result
) {}
