package com.docsage.api.controller;

import jakarta.validation.constraints.NotBlank;

public record SummarizeRequest(
    @NotBlank String filename
) {}
