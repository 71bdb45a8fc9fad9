package com.docsage.api.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.queue")
public record QueueProperties(
    @NotBlank String provider,
    String baseUrl,
    @NotNull Duration timeout,
    @NotBlank String webhookBaseUrl
) {
    public String webhookUrl() {
        String base = webhookBaseUrl.endsWith("/")
            ? webhookBaseUrl.substring(0, webhookBaseUrl.length() - 1)
            : webhookBaseUrl;
        return base + "/internal/notify";
    }
}
