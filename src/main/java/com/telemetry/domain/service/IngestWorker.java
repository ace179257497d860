package com.telemetry.domain.service;

import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus;
import com.telemetry.infrastructure.persistence.repository.IngestJobRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ingest queue poll loop.
 *
 * Processing Flow:
 * 1. Every {@code poll-interval-ms}, fetch up to {@code batch-size} runnable jobs (oldest first)
 * 2. Keep one job per session so a batch never works on a session twice
 * 3. Fan the batch out over {@code concurrency} workers sharing one cursor
 * 4. Return once every worker has drained the batch
 *
 * Shutdown clears the running flag first; workers finish the job in hand
 * and stop taking new ones before the pool is shut down.
 */
@Slf4j
@Service
public class IngestWorker {

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final IngestJobRepository jobRepository;
    private final ArtifactJobProcessor processor;
    private final ExecutorService executor;
    private final Clock clock;
    private final int concurrency;
    private final int batchSize;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicReference<Instant> lastPollAt = new AtomicReference<>();

    public IngestWorker(IngestJobRepository jobRepository,
                        ArtifactJobProcessor processor,
                        @Qualifier("ingestJobExecutor") ExecutorService executor,
                        Clock clock,
                        @Value("${ingest.worker.concurrency:4}") int concurrency,
                        @Value("${ingest.worker.batch-size:20}") int batchSize) {
        this.jobRepository = jobRepository;
        this.processor = processor;
        this.executor = executor;
        this.clock = clock;
        this.concurrency = concurrency;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${ingest.worker.poll-interval-ms:500}")
    public void poll() {
        if (!running.get()) {
            return;
        }
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Error polling ingest jobs: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of jobs handed to the processor
     */
    public int pollOnce() {
        Instant now = clock.instant();
        lastPollAt.set(now);

        List<IngestJobEntity> jobs = jobRepository.findRunnable(JobStatus.PENDING, now, PageRequest.of(0, batchSize));
        if (jobs.isEmpty()) {
            return 0;
        }
        List<IngestJobEntity> batch = onePerSession(jobs);
        log.info("Processing {} ingest jobs ({} fetched)", batch.size(), jobs.size());

        AtomicInteger cursor = new AtomicInteger();
        AtomicInteger processed = new AtomicInteger();
        int workers = Math.max(1, Math.min(concurrency, batch.size()));

        List<Future<?>> futures = new ArrayList<>(workers);
        try {
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(() -> drain(batch, cursor, processed)));
            }
        } catch (RejectedExecutionException e) {
            log.warn("Ingest executor rejected a worker, {} of {} running", futures.size(), workers);
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for ingest workers");
                break;
            } catch (ExecutionException e) {
                log.error("Ingest worker terminated abnormally", e.getCause());
            }
        }
        return processed.get();
    }

    private void drain(List<IngestJobEntity> batch, AtomicInteger cursor, AtomicInteger processed) {
        while (running.get()) {
            int index = cursor.getAndIncrement();
            if (index >= batch.size()) {
                return;
            }
            IngestJobEntity job = batch.get(index);
            try {
                processor.process(job);
            } catch (RuntimeException e) {
                log.error("Unhandled error processing job {}", job.getId(), e);
            }
            processed.incrementAndGet();
        }
    }

    /**
     * First job of each session, in fetch order. Jobs without a session are
     * keyed by their own id.
     */
    static List<IngestJobEntity> onePerSession(List<IngestJobEntity> jobs) {
        Map<String, IngestJobEntity> bySession = new LinkedHashMap<>();
        for (IngestJobEntity job : jobs) {
            String key = job.getSessionId() != null ? job.getSessionId() : "job:" + job.getId();
            bySession.putIfAbsent(key, job);
        }
        return new ArrayList<>(bySession.values());
    }

    public boolean isRunning() {
        return running.get();
    }

    public Instant getLastPollAt() {
        return lastPollAt.get();
    }

    @PreDestroy
    public void stop() {
        log.info("Ingest worker shutting down...");
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Ingest jobs still running after {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
