package com.docsage.api.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Long-poll tuning. {@code maxRequestDuration} is the hard limit the hosting
 * platform puts on a single request; a poll never waits past it minus
 * {@code responseMargin}.
 */
@Validated
@ConfigurationProperties(prefix = "app.notifications.poll")
public record PollProperties(
    @NotNull Duration defaultTimeout,
    @NotNull Duration maxTimeout,
    @NotNull Duration maxRequestDuration,
    @NotNull Duration responseMargin,
    @NotNull Duration recheckInterval,
    @NotNull @Min(1) @Max(10000) Integer maxBatch,
    @NotNull @Min(1) @Max(10000) Integer concurrency
) {}
