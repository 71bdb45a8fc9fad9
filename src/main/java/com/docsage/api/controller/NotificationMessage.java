package com.docsage.api.controller;

import com.docsage.api.model.NotificationRecord;
import com.docsage.api.model.NotificationStatus;
import com.docsage.api.model.NotificationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationMessage(
    long id,
    NotificationType type,
    String filename,
    NotificationStatus status,
    String result,
    String error,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static NotificationMessage from(NotificationRecord record) {
        return new NotificationMessage(
            record.id(),
            record.type(),
            record.filename(),
            record.status(),
            record.result(),
            record.error(),
            record.createdAt()
        );
    }
}
