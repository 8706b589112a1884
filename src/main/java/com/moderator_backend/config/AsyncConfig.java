package com.moderator_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
public class AsyncConfig {

    @Value("${app.updates.async:true}")
    private boolean async;

    @Value("${app.updates.pool-size:2}")
    private int poolSize;

    /**
     * Runs update notifications. Synchronous dispatch keeps the notifier on the committing thread.
     */
    @Bean("updateNotifierExecutor")
    public TaskExecutor updateNotifierExecutor() {
        if (!async) {
            log.info("Update notifications dispatched synchronously");
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("update-notifier-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
