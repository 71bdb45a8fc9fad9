package com.docsage.api.model;

/**
 * Raw completion report as sent by the queue worker, before validation.
 */
public record CompletionPayload(
    String type,
    String filename,
    String status,
    String result,
    String error
) {}
