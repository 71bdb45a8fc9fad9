package com.docsage.api.controller;

import jakarta.validation.constraints.NotBlank;

public record SummaryQaRequest(
    @NotBlank String filename,
    @NotBlank String question
) {}
