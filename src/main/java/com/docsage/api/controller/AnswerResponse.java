package com.docsage.api.controller;

public record AnswerResponse(
    String answer
) {}
