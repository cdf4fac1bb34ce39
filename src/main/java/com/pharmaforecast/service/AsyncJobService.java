package com.pharmaforecast.service;

import com.pharmaforecast.dto.AsyncJobResponse;
import com.pharmaforecast.dto.AsyncJobStatus;
import com.pharmaforecast.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * In-memory tracking for long-running operations such as retraining.
 * Each job is held as an immutable status value that is replaced on every
 * transition. Once more than {@code jobs.max-retained} jobs are tracked,
 * finished ones are evicted in the order they finished.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncJobService {

    private final Clock clock;

    @Value("${jobs.pool-size:2}")
    private int poolSize;

    @Value("${jobs.max-retained:100}")
    private int maxRetained;

    private ExecutorService executor;
    private final Map<UUID, AsyncJobResponse> jobs = new ConcurrentHashMap<>();
    private final Queue<UUID> finished = new ConcurrentLinkedQueue<>();

    @PostConstruct
    void init() {
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize), r -> {
            Thread t = new Thread(r, "forecast-job-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<Object> task) {
        UUID jobId = UUID.randomUUID();
        jobs.put(jobId, AsyncJobResponse.builder()
            .jobId(jobId)
            .jobType(jobType)
            .status(AsyncJobStatus.QUEUED)
            .createdAt(clock.instant())
            .message("Queued")
            .requestId(requestId)
            .build());
        evictFinished();

        log.info("Job queued | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        CompletableFuture.runAsync(() -> run(jobId, task), executor);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        AsyncJobResponse job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void run(UUID jobId, Supplier<Object> task) {
        transition(jobId, job -> job.toBuilder()
            .status(AsyncJobStatus.RUNNING)
            .startedAt(clock.instant())
            .message("Running")
            .build());
        UnaryOperator<AsyncJobResponse> outcome;
        try {
            Object result = task.get();
            outcome = job -> job.toBuilder()
                .status(AsyncJobStatus.COMPLETED)
                .completedAt(clock.instant())
                .message("Completed")
                .result(result)
                .build();
            log.info("Job completed | jobId={}", jobId);
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            outcome = job -> job.toBuilder()
                .status(AsyncJobStatus.FAILED)
                .completedAt(clock.instant())
                .message(reason)
                .build();
            log.error("Job failed | jobId={} | cause={}", jobId, reason, ex);
        }
        // queued before the final status is published
        finished.add(jobId);
        transition(jobId, outcome);
    }

    private void transition(UUID jobId, UnaryOperator<AsyncJobResponse> change) {
        jobs.computeIfPresent(jobId, (id, job) -> change.apply(job));
    }

    private void evictFinished() {
        while (jobs.size() > maxRetained) {
            UUID oldest = finished.poll();
            if (oldest == null) {
                return;
            }
            jobs.remove(oldest);
        }
    }
}
