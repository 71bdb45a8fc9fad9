package com.docsage.api.model;

import java.time.OffsetDateTime;

public record SummaryRecord(
    String filename,
    String summary,
    OffsetDateTime createdAt
) {}
