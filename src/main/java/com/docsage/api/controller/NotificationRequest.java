package com.docsage.api.controller;

import com.docsage.api.model.CompletionPayload;

public record NotificationRequest(
    String type,
    String filename,
    String status,
    String result,
    String error
) {
    public CompletionPayload toPayload() {
        return new CompletionPayload(type, filename, status, result, error);
    }
}
