package com.foursite.growth.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executor for after-commit trigger dispatch
 */
@Configuration
@EnableAsync
@ConditionalOnProperty(prefix = "growth.dispatch", name = "async", havingValue = "true", matchIfMissing = true)
public class AsyncConfig {

    public static final String DISPATCH_EXECUTOR = "dispatchExecutor";

    @Bean(DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("growth-dispatch-");
        // a full queue runs the dispatch on the committing thread instead of dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
