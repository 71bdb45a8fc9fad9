package com.docsage.api.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record IngestRequest(
    @NotBlank String filename,
    @JsonProperty("document_set") String documentSet
) {}
