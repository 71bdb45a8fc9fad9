package com.docsage.api.controller;

public record ErrorResponse(
    String detail,
    int status,
    long timestamp
) {}
