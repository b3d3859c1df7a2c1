package com.simboard.backend.global.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Async executors for best-effort bookkeeping writes.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String TOKEN_USAGE_EXECUTOR = "tokenUsageExecutor";

    static final int TOKEN_USAGE_CORE_POOL = 1;
    static final int TOKEN_USAGE_MAX_POOL = 2;
    static final int TOKEN_USAGE_QUEUE_CAPACITY = 500;

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Last-used stamps for API tokens. The queue is bounded and overflow is rejected with
     * {@link org.springframework.core.task.TaskRejectedException}, which callers drop.
     */
    @Bean(name = TOKEN_USAGE_EXECUTOR)
    public ThreadPoolTaskExecutor tokenUsageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(TOKEN_USAGE_CORE_POOL);
        executor.setMaxPoolSize(TOKEN_USAGE_MAX_POOL);
        executor.setQueueCapacity(TOKEN_USAGE_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("token-usage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        log.info("Token usage executor initialized with core={}, max={}, queueCapacity={}",
                TOKEN_USAGE_CORE_POOL, TOKEN_USAGE_MAX_POOL, TOKEN_USAGE_QUEUE_CAPACITY);
        return executor;
    }
}
