package com.docsage.api.repository;

import com.docsage.api.model.NotificationDraft;
import com.docsage.api.model.NotificationRecord;

import java.util.List;

public interface NotificationLogRepository {
    NotificationRecord append(NotificationDraft draft);
    List<NotificationRecord> readSince(long cursorExclusive);
    List<NotificationRecord> readSince(long cursorExclusive, int limit);
    long latestId();
}
