package com.telemetry.infrastructure.async;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs fire-and-forget work (promotion, frame prewarm, funnel analysis,
 * shadow replication, issue tracking) on a bounded pool.
 *
 * Failures are logged and counted here and never reach the caller.
 */
@Slf4j
@Component
public class BackgroundTaskRunner {

    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public BackgroundTaskRunner(@Qualifier("backgroundTaskExecutor") Executor executor,
                                MeterRegistry meterRegistry) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public void submit(String taskName, Runnable task) {
        try {
            executor.execute(() -> runLogged(taskName, task));
        } catch (RejectedExecutionException e) {
            log.warn("Background task {} rejected, pool saturated", taskName);
            count(taskName, "rejected");
        }
    }

    private void runLogged(String taskName, Runnable task) {
        try {
            task.run();
            count(taskName, "success");
        } catch (RuntimeException e) {
            log.error("Background task {} failed: {}", taskName, e.getMessage(), e);
            count(taskName, "failed");
        }
    }

    private void count(String taskName, String result) {
        Counter.builder("background.tasks")
                .tag("task", taskName)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
