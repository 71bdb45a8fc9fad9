package com.docsage.api.model;

/**
 * A notification that has not been appended yet, so it has no cursor.
 */
public record NotificationDraft(
    NotificationType type,
    String filename,
    NotificationStatus status,
    String result,
    String error
) {
    public boolean carriesSummary() {
        return type == NotificationType.SUMMARIZATION && status == NotificationStatus.COMPLETED;
    }
}
