package com.docsage.api.config;

import com.docsage.api.infra.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // No queue: a poll that finds every thread busy is rejected at once
    // instead of waiting for a slot and overrunning the request deadline.
    @Bean(name = "pollTaskExecutor")
    public AsyncTaskExecutor pollTaskExecutor(PollProperties pollProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pollProperties.concurrency());
        executor.setMaxPoolSize(pollProperties.concurrency());
        executor.setQueueCapacity(0);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("poll-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        return executor;
    }
}
