package com.docsage.api.controller;

public record HealthResponse(
    String status
) {}
