package com.cognix.universalSearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the two fan-out points: providers within a search, and detail lookups within a provider.
 *
 * They are separate so a provider thread waiting on its detail lookups never competes with them for a slot.
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService providerExecutor(UniversalSearchProperties properties) {
        int maxConcurrency = properties.getAggregator().getMaxConcurrency();
        ThreadFactory threads = namedDaemonThreads("provider-fetch-");
        return maxConcurrency > 0
                ? Executors.newFixedThreadPool(maxConcurrency, threads)
                : Executors.newCachedThreadPool(threads);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("detail-enrich-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
