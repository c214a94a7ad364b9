package com.causalbacktest.backtester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for parameter sweeps. Every combination of a sweep runs as one task.
 */
@Configuration
public class AsyncConfig {

    @Value("${backtest.worker.thread-count:3}")
    private int workerThreadCount;

    @Bean(name = "sweepExecutorService", destroyMethod = "shutdown")
    public ExecutorService sweepExecutorService() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workerThreadCount,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("SweepWorker-" + counter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
