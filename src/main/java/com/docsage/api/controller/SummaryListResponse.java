package com.docsage.api.controller;

import com.docsage.api.model.SummaryRecord;

import java.util.List;

public record SummaryListResponse(
    List<SummaryResponse> summaries
) {
    public static SummaryListResponse of(List<SummaryRecord> records) {
        return new SummaryListResponse(records.stream().map(SummaryResponse::from).toList());
    }
}
