package com.telemetry.config;

import com.telemetry.infrastructure.storage.StorageProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Shared infrastructure beans of the ingest pipeline.
 *
 * Time and randomness are beans so sampling, backoff and endpoint
 * selection can be driven deterministically in tests.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class IngestConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DoubleSupplier randomSource() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    @Bean(name = "ingestJobExecutor", destroyMethod = "")
    public ExecutorService ingestJobExecutor(@Value("${ingest.worker.concurrency:4}") int concurrency) {
        // shut down by IngestWorker once in-flight jobs are done
        return Executors.newFixedThreadPool(Math.max(1, concurrency), new CustomizableThreadFactory("ingest-worker-"));
    }

    @Bean(name = "backgroundTaskExecutor")
    public ThreadPoolTaskExecutor backgroundTaskExecutor(
            @Value("${ingest.background.pool-size:4}") int poolSize,
            @Value("${ingest.background.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ingest-bg-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
