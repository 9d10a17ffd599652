package com.sentinel.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools. Moderation events run on a bounded pool with no global lock;
 * classifier calls get their own pool so a slow backend cannot starve event workers.
 */
@Configuration
@EnableScheduling
public class ModerationExecutorConfig {

    @Bean(name = "moderationEventExecutor")
    public ThreadPoolTaskExecutor moderationEventExecutor(
            @Value("${sentinel.workers.core-size:8}") int coreSize,
            @Value("${sentinel.workers.max-size:32}") int maxSize,
            @Value("${sentinel.workers.queue-capacity:5000}") int queueCapacity) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(coreSize);
        ex.setMaxPoolSize(maxSize);
        ex.setQueueCapacity(queueCapacity);
        ex.setKeepAliveSeconds(60);
        ex.setThreadNamePrefix("moderation-");
        ex.setAwaitTerminationSeconds(10);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    @Bean(name = "classifierExecutor")
    public ThreadPoolTaskExecutor classifierExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(16);
        ex.setQueueCapacity(1000);
        ex.setThreadNamePrefix("classifier-");
        ex.initialize();
        return ex;
    }
}
