package com.docsage.api.controller;

import com.docsage.api.model.SummaryRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record SummaryResponse(
    String filename,
    String summary,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static SummaryResponse from(SummaryRecord record) {
        return new SummaryResponse(record.filename(), record.summary(), record.createdAt());
    }
}
