package com.example.runbookops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for runbook execution and escalation delivery.
 */
@Configuration
public class AsyncConfig {

    /**
     * Sized by the per-instance worker concurrency; jobs beyond that wait in the queue table.
     */
    @Bean(name = "runbookExecutor")
    public ThreadPoolTaskExecutor runbookExecutor(RunbookOpsProperties properties) {
        int concurrency = Math.max(1, properties.getWorker().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("runbook-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "escalationExecutor")
    public ThreadPoolTaskExecutor escalationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("escalation-");
        executor.initialize();
        return executor;
    }
}
