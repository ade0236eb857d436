package com.localcooks.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for the per-unit payment provider calls of a decision.
 * When the queue is full the request thread runs the call itself rather than failing the unit.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "paymentExecutor")
    public Executor paymentExecutor(@Value("${booking.decision.executor.core-pool-size:8}") int corePoolSize,
                                    @Value("${booking.decision.executor.max-pool-size:32}") int maxPoolSize,
                                    @Value("${booking.decision.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("payment-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
