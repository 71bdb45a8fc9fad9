package com.docsage.api.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String key;

    public EntityNotFoundException(String message, String key) {
        super(message);
        this.key = key;
    }

    public static EntityNotFoundException summary(String filename) {
        return new EntityNotFoundException("Summary not found", filename);
    }

    public static EntityNotFoundException task(String taskId) {
        return new EntityNotFoundException("Task not found: " + taskId, taskId);
    }
}
