package com.poolpulse.indexer.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors, clock and HTTP client shared by the pipeline.
 */
@Configuration
public class ProcessingConfig {

    /**
     * Bounded worker pool for decoded pool events. When the queue is full the
     * subscription thread runs the event itself, which slows log consumption down.
     */
    @Bean(name = "eventExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor eventExecutor(PoolPulseProperties properties) {
        int workers = properties.getProcessing().getWorkerThreads();
        return new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.getProcessing().getQueueCapacity()),
                namedThreads("pool-event-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean(name = "statsTaskScheduler")
    public ThreadPoolTaskScheduler statsTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("stats-job-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "priceIndexRestTemplate")
    public RestTemplate priceIndexRestTemplate(RestTemplateBuilder builder, PoolPulseProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getValuation().getPriceIndex().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
