package com.delta.research.pipeline.service;

import com.delta.research.config.ResearchProperties;
import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.WorkerStatusResponse;
import com.delta.research.pipeline.persistence.ResearchJobRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background worker pool for server deployments. Each thread runs the same claim loop as the CLI.
 */
@Service
public class ResearchWorkerDaemon {
    private static final Logger log = LoggerFactory.getLogger(ResearchWorkerDaemon.class);

    private final ResearchWorkerService workerService;
    private final ResearchJobRepository jobRepository;
    private final ResearchProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private int activeWorkerCount;

    public ResearchWorkerDaemon(
        ResearchWorkerService workerService,
        ResearchJobRepository jobRepository,
        ResearchProperties properties
    ) {
        this.workerService = workerService;
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public WorkerStatusResponse getStatus() {
        long queued;
        long runningJobs;
        try {
            queued = jobRepository.countByStatus(JobStatus.QUEUED);
            runningJobs = jobRepository.countByStatus(JobStatus.RUNNING);
        } catch (Exception e) {
            log.warn("Failed to load research job counts", e);
            queued = 0;
            runningJobs = 0;
        }
        return new WorkerStatusResponse(workerService.getWorkerId(), running.get(), activeWorkerCount, queued, runningJobs);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getWorker().getDaemon().getWorkers();
            int pollSleepSeconds = properties.getWorker().getPollSleepSeconds();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("research-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollSleepSeconds));
            }
            log.info("Research worker daemon started with {} workers", workerCount);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Research worker daemon stopped");
        }
    }

    private void workerLoop(int workerIndex, int pollSleepSeconds) {
        Thread.currentThread().setName("research-worker-" + workerIndex);
        String threadWorkerId = workerService.getWorkerId() + "-" + workerIndex;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            ResearchWorkerService.WorkerResult result;
            try {
                result = workerService.runOnce(threadWorkerId);
            } catch (Exception e) {
                log.warn("Research worker {} failed to process a job", workerIndex, e);
                sleep(pollSleepSeconds);
                continue;
            }
            if (result == null) {
                sleep(pollSleepSeconds);
            }
        }
    }

    private void sleep(int seconds) {
        try {
            TimeUnit.SECONDS.sleep(Math.max(1, seconds));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
