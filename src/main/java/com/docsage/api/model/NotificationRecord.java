package com.docsage.api.model;

import java.time.OffsetDateTime;

public record NotificationRecord(
    long id,
    NotificationType type,
    String filename,
    NotificationStatus status,
    String result,
    String error,
    OffsetDateTime createdAt
) {}
