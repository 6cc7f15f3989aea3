package com.geekhub.collector.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${collector.enrichment.concurrency:10}")
    private int enrichmentConcurrency;

    /**
     * Worker pool for translation jobs. The queue itself bounds admission,
     * so the pool only needs as many threads as there are permits. Rejections
     * must surface as exceptions so the queue can hand the permit back.
     */
    @Bean(name = "enrichmentExecutor")
    public Executor enrichmentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(enrichmentConcurrency);
        executor.setMaxPoolSize(enrichmentConcurrency);
        executor.setQueueCapacity(enrichmentConcurrency);
        executor.setThreadNamePrefix("enrichment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
