package com.docsage.api.controller;

import com.docsage.api.model.NotificationRecord;

import java.util.List;

public record PollResponse(
    List<NotificationMessage> messages
) {
    public static PollResponse empty() {
        return new PollResponse(List.of());
    }

    public static PollResponse of(List<NotificationRecord> records) {
        return new PollResponse(records.stream().map(NotificationMessage::from).toList());
    }
}
