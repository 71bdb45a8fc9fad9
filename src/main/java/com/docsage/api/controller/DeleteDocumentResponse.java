package com.docsage.api.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteDocumentResponse(
    String message,
    @JsonProperty("summaries_removed") int summariesRemoved
) {}
