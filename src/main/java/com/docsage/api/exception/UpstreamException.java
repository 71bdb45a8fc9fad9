package com.docsage.api.exception;

import lombok.Getter;

/**
 * Failure of an external collaborator (LLM provider, task queue).
 */
@Getter
public class UpstreamException extends RuntimeException {
    private final String upstream;

    public UpstreamException(String upstream, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
    }

    public UpstreamException(String upstream, String message) {
        super(message);
        this.upstream = upstream;
    }
}
