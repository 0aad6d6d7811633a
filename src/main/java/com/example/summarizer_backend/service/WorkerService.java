package com.example.summarizer_backend.service;

import com.example.summarizer_backend.config.WorkerExecutorProperties;
import com.example.summarizer_backend.exception.JobConflictException;
import com.example.summarizer_backend.util.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Pulls queued jobs and runs each end to end on one pool thread. A semaphore caps how many pipelines run at
 * once; the active set makes sure a job id never has two runs in this process.
 */
@Service
public class WorkerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    private final SummaryJobStore store;
    private final SummaryPipeline pipeline;
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final Semaphore runSemaphore;
    private final Set<UUID> active = ConcurrentHashMap.newKeySet();

    public WorkerService(SummaryJobStore store,
                         SummaryPipeline pipeline,
                         @Qualifier("workerTaskExecutor") Executor workerExecutor,
                         WorkerExecutorProperties workerProperties) {
        this.store = store;
        this.pipeline = pipeline;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.runSemaphore = new Semaphore(Math.max(1, workerProperties.getMaxConcurrency()));
    }

    @Scheduled(fixedDelayString = "${worker.poll-interval-ms:2000}")
    public void poll() {
        int capacity = Math.max(1, workerProperties.getMaxConcurrency()) + Math.max(0, workerProperties.getExecutorQueueCapacity());
        int free = capacity - active.size();
        int batch = Math.min(workerProperties.getPollBatchSize(), free);
        if (batch <= 0) {
            LOGGER.debug("Worker poll tick - pool saturated active={}", active.size());
            return;
        }
        List<UUID> ids = store.claimQueued(batch);
        if (ids.isEmpty()) {
            LOGGER.debug("Worker poll tick - no jobs claimed");
            return;
        }
        LOGGER.info("Worker claimed jobs count={} ids={}", ids.size(), ids);
        ids.forEach(this::submit);
    }

    /**
     * Claims one specific queued job and starts it right away.
     *
     * @throws JobConflictException when the job is already running or is not queued.
     */
    public void dispatch(UUID jobId) {
        if (active.contains(jobId)) {
            throw new JobConflictException("Summary " + jobId + " is already being processed");
        }
        if (!store.claim(jobId)) {
            throw new JobConflictException("Summary " + jobId + " is not queued");
        }
        submit(jobId);
    }

    /** Whether a freshly dispatched job would start right away instead of waiting on the semaphore. */
    public boolean hasIdleSlot() {
        return active.size() < Math.max(1, workerProperties.getMaxConcurrency());
    }

    public int activeCount() {
        return active.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOrphans() {
        int n = store.failOrphans();
        if (n > 0) {
            LOGGER.warn("Worker recovered orphaned jobs count={}", n);
        }
    }

    private void submit(UUID jobId) {
        if (!active.add(jobId)) {
            throw new JobConflictException("Summary " + jobId + " is already being processed");
        }
        try {
            workerExecutor.execute(() -> runWithSemaphore(jobId));
        } catch (RejectedExecutionException e) {
            active.remove(jobId);
            LOGGER.error("Worker rejected jobId={}: {}", jobId, e.toString());
            store.fail(jobId, ErrorKind.INTERNAL, "worker queue full");
        }
    }

    private void runWithSemaphore(UUID jobId) {
        boolean acquired = false;
        try {
            runSemaphore.acquire();
            acquired = true;
            pipeline.run(jobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Worker interrupted before jobId={} started", jobId);
            store.fail(jobId, ErrorKind.INTERNAL, "worker interrupted");
        } catch (Exception e) {
            LOGGER.error("Job {} failed: {}", jobId, e.toString(), e);
            store.fail(jobId, ErrorKind.INTERNAL, stackTop(e));
        } finally {
            if (acquired) {
                runSemaphore.release();
            }
            active.remove(jobId);
        }
    }

    private static String stackTop(Throwable t) {
        StackTraceElement[] st = t.getStackTrace();
        String where = st.length == 0 ? "" : " at " + st[0];
        return t.getClass().getSimpleName() + ": " + t.getMessage() + where;
    }
}
