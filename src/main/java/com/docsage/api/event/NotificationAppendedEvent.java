package com.docsage.api.event;

public record NotificationAppendedEvent(long notificationId) {}
