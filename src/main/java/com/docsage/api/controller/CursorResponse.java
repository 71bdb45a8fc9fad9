package com.docsage.api.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CursorResponse(
    @JsonProperty("latest_id") long latestId
) {}
