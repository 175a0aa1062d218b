package com.futuresdca.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for sweep candidates. Simulations are CPU-bound, so the pool
 * defaults to one thread per core; when the queue is full the submitting thread runs
 * the candidate itself.
 */
@Configuration
public class SweepExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(SweepExecutorConfig.class);

    @Bean("sweepExecutor")
    public ThreadPoolTaskExecutor sweepExecutor(SweepProperties sweepProperties) {
        int threads = sweepProperties.getWorkerThreads() > 0
                ? sweepProperties.getWorkerThreads()
                : Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(sweepProperties.getQueueCapacity());
        executor.setThreadNamePrefix("sweep-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("Sweep executor configured with {} worker threads", threads);
        return executor;
    }
}
