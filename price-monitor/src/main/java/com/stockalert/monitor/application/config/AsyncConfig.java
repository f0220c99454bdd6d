package com.stockalert.monitor.application.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for metered provider chunks. Admission and budget accounting stay on the
 * cycle thread; only the HTTP round trip runs here. CallerRuns keeps a full queue from
 * dropping a chunk that was already admitted by the rate limiter.
 */
@Configuration
public class AsyncConfig {

    @Bean
    public ThreadPoolTaskExecutor providerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("provider-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
