package com.backtester.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor shared by market-data loading and by independent simulations (a strategy and
 * its benchmarks, or a batch of compared strategies). A single run never uses more than
 * one thread.
 */
@Configuration
public class AsyncConfig {

    @Value("${backtester.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${backtester.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${backtester.async.queue-capacity:100}")
    private int queueCapacity;

    @Bean("backtestExecutor")
    public ThreadPoolTaskExecutor backtestExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("backtest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
