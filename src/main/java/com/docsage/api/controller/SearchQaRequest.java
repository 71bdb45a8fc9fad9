package com.docsage.api.controller;

import com.docsage.api.model.SourceSnippet;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SearchQaRequest(
    @NotBlank String question,
    @NotNull @JsonProperty("context_results") List<@NotNull @Valid ContextResult> contextResults
) {
    static final String UNKNOWN_SOURCE = "unknown";

    /**
     * A vector-search hit. The filename normally sits under {@code metadata};
     * a top-level {@code filename} is accepted as well.
     */
    public record ContextResult(
        @NotNull String content,
        String filename,
        Metadata metadata
    ) {
        public String sourceName() {
            if (metadata != null && metadata.filename() != null && !metadata.filename().isBlank()) {
                return metadata.filename();
            }
            if (filename != null && !filename.isBlank()) {
                return filename;
            }
            return UNKNOWN_SOURCE;
        }
    }

    public record Metadata(
        String filename
    ) {}

    public List<SourceSnippet> sources() {
        return contextResults.stream()
            .map(r -> new SourceSnippet(r.sourceName(), r.content()))
            .toList();
    }
}
