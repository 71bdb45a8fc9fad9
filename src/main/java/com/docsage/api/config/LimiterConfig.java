package com.docsage.api.config;

import com.docsage.api.infra.InMemoryRpmRateLimiter;
import com.docsage.api.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(@Value("${app.qa.rpm:30}") int rpm) {
        return new InMemoryRpmRateLimiter(rpm);
    }
}
