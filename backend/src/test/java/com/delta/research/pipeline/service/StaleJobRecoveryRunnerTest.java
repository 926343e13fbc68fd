package com.delta.research.pipeline.service;

import com.delta.research.pipeline.JobQueueTestSupport;
import com.delta.research.pipeline.model.CreateRunRequest;
import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.ResearchEvent;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.StepStatus;
import com.delta.research.pipeline.persistence.ResearchJobRepository;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StaleJobRecoveryRunnerTest {

    @Autowired
    private StaleJobRecoveryRunner recoveryRunner;

    @Autowired
    private ResearchRunService runService;

    @Autowired
    private PlanService planService;

    @Autowired
    private ResearchJobRepository jobRepository;

    @Autowired
    private ResearchPlanRepository planRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String tenantId;

    @BeforeEach
    void setUp() {
        JobQueueTestSupport.parkOpenJobs(jdbcTemplate);
        tenantId = "tenant-" + UUID.randomUUID();
    }

    @Test
    void abandonedJobGoesBackToTheQueueWithItsStep() {
        ResearchRun run = runService.createRun(tenantId, new CreateRunRequest("stale", null));
        runService.startRun(tenantId, run.id());
        ResearchJob claimed = jobRepository.claimNextJob("worker-that-died");
        assertThat(claimed.runId()).isEqualTo(run.id());
        ResearchStep step = planService.claimNextStep(tenantId, run.id()).step();
        assertThat(step.status()).isEqualTo(StepStatus.RUNNING);

        int recovered = recoveryRunner.recoverAll(Instant.now().plusSeconds(5));

        assertThat(recovered).isEqualTo(1);
        ResearchJob job = jobRepository.findJob(claimed.id());
        assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.attemptCount()).isEqualTo(1);
        assertThat(job.lastError()).isEqualTo(StaleJobRecoveryRunner.STALE_ERROR);
        assertThat(job.lockedBy()).isNull();
        assertThat(job.nextRetryAt()).isAfter(Instant.now());

        ResearchStep reset = planRepository.findStep(step.id());
        assertThat(reset.status()).isEqualTo(StepStatus.FAILED);
        assertThat(reset.nextRetryAt()).isNotNull();
        assertThat(reset.lastError()).isEqualTo(StaleJobRecoveryRunner.STALE_ERROR);

        List<String> events = runService.listEvents(tenantId, run.id()).stream()
            .map(ResearchEvent::eventType)
            .toList();
        assertThat(events).contains(StaleJobRecoveryRunner.STALE_ERROR);
    }

    @Test
    void freshLocksAreLeftAlone() {
        ResearchRun run = runService.createRun(tenantId, new CreateRunRequest("fresh", null));
        runService.startRun(tenantId, run.id());
        ResearchJob claimed = jobRepository.claimNextJob("worker-alive");

        int recovered = recoveryRunner.recoverAll(Instant.now().minusSeconds(60));

        assertThat(recovered).isZero();
        assertThat(jobRepository.findJob(claimed.id()).status()).isEqualTo(JobStatus.RUNNING);
    }
}
