package com.delta.research.pipeline.service;

import com.delta.research.config.ResearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Command-line worker: {@code --once} processes one claimable job, {@code --loop --sleep N} polls
 * until interrupted.
 */
@Component
public class ResearchWorkerCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ResearchWorkerCliRunner.class);

    private final ResearchProperties properties;
    private final ResearchWorkerService workerService;
    private final ConfigurableApplicationContext applicationContext;

    public ResearchWorkerCliRunner(
        ResearchProperties properties,
        ResearchWorkerService workerService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.workerService = workerService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean loop = args.containsOption("loop");
        boolean once = args.containsOption("once") || (!loop && properties.getWorker().getCli().isEnabled());
        if (!loop && !once) {
            return;
        }

        if (loop) {
            int sleepSeconds = sleepSeconds(args, properties.getWorker().getPollSleepSeconds());
            log.info("Worker {} polling every {}s", workerService.getWorkerId(), sleepSeconds);
            runLoop(sleepSeconds);
        } else {
            ResearchWorkerService.WorkerResult result = workerService.runOnce();
            if (result == null) {
                log.info("Worker {}: no claimable job", workerService.getWorkerId());
            } else {
                log.info("Worker {}: job {} run {} -> {}", workerService.getWorkerId(), result.jobId(), result.runId(), result.outcome());
            }
        }

        if (properties.getWorker().getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private void runLoop(int sleepSeconds) {
        while (!Thread.currentThread().isInterrupted()) {
            ResearchWorkerService.WorkerResult result;
            try {
                result = workerService.runOnce();
            } catch (Exception e) {
                log.warn("Worker loop iteration failed", e);
                result = null;
            }
            if (result != null) {
                log.info("Job {} run {} -> {}", result.jobId(), result.runId(), result.outcome());
                continue;
            }
            try {
                TimeUnit.SECONDS.sleep(sleepSeconds);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Worker loop interrupted, stopping");
    }

    /**
     * Accepts both {@code --sleep=N} and {@code --sleep N}.
     */
    static int sleepSeconds(ApplicationArguments args, int fallback) {
        List<String> values = args.getOptionValues("sleep");
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    return parsePositive(value, fallback);
                }
            }
        }
        String[] raw = args.getSourceArgs();
        for (int i = 0; i + 1 < raw.length; i++) {
            if ("--sleep".equals(raw[i])) {
                return parsePositive(raw[i + 1], fallback);
            }
        }
        return fallback;
    }

    private static int parsePositive(String value, int fallback) {
        try {
            return Math.max(1, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid --sleep value '{}'", value);
            return fallback;
        }
    }
}
