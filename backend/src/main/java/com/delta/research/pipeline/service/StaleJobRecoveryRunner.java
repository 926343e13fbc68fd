package com.delta.research.pipeline.service;

import com.delta.research.config.ResearchProperties;
import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.ResearchJobRepository;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import com.delta.research.pipeline.persistence.ResearchRunRepository;
import com.delta.research.pipeline.util.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * On startup, returns jobs whose worker died mid-run to the queue. Recovery consumes one job
 * attempt; the interrupted steps go back to failed with backoff.
 */
@Component
@Order(0)
public class StaleJobRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleJobRecoveryRunner.class);
    static final String STALE_ERROR = "stale_lock_recovered";

    private final ResearchJobRepository jobRepository;
    private final ResearchRunRepository runRepository;
    private final ResearchPlanRepository planRepository;
    private final ResearchEventRepository eventRepository;
    private final ResearchProperties properties;

    public StaleJobRecoveryRunner(
        ResearchJobRepository jobRepository,
        ResearchRunRepository runRepository,
        ResearchPlanRepository planRepository,
        ResearchEventRepository eventRepository,
        ResearchProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.planRepository = planRepository;
        this.eventRepository = eventRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<ResearchJob> stale;
        try {
            Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getJobs().getStaleLockMinutes()));
            stale = jobRepository.findStaleRunningJobs(cutoff);
        } catch (Exception e) {
            log.warn("Skipping stale job recovery because the job table is unreachable", e);
            return;
        }
        for (ResearchJob job : stale) {
            recover(job);
        }
    }

    int recoverAll(Instant lockedBefore) {
        List<ResearchJob> stale = jobRepository.findStaleRunningJobs(lockedBefore);
        for (ResearchJob job : stale) {
            recover(job);
        }
        return stale.size();
    }

    private void recover(ResearchJob job) {
        int attempt = job.attemptCount() + 1;
        Instant nextRetryAt = BackoffPolicy.nextRetryAt(Instant.now(), attempt);
        int resetSteps = planRepository.resetRunningSteps(job.tenantId(), job.runId(), nextRetryAt, STALE_ERROR);
        JobStatus status = jobRepository.markFailed(job.id(), STALE_ERROR, BackoffPolicy.backoffSeconds(attempt), false);
        if (status == JobStatus.FAILED) {
            runRepository.markFailed(job.tenantId(), job.runId(), STALE_ERROR);
        }
        eventRepository.append(
            job.tenantId(),
            job.runId(),
            STALE_ERROR,
            "warn",
            Map.of("job_id", job.id().toString(), "locked_by", String.valueOf(job.lockedBy())),
            Map.of("steps_reset", resetSteps, "job_status", status.value()),
            null
        );
        log.info("Recovered stale job {} (locked by {} at {}) -> {}", job.id(), job.lockedBy(), job.lockedAt(), status.value());
    }
}
