package com.docsage.api.model;

/**
 * A search hit the caller passes in as QA context.
 */
public record SourceSnippet(
    String filename,
    String content
) {}
