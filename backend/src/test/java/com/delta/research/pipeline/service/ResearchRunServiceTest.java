package com.delta.research.pipeline.service;

import com.delta.research.pipeline.JobQueueTestSupport;
import com.delta.research.pipeline.model.AttachSourceRequest;
import com.delta.research.pipeline.model.CreateRunRequest;
import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.ResearchEvent;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.RunStatus;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.model.StepStatus;
import com.delta.research.pipeline.service.ResearchWorkerService.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class ResearchRunServiceTest {

    @Autowired
    private ResearchRunService runService;

    @Autowired
    private ResearchWorkerService workerService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String tenantId;

    @BeforeEach
    void setUp() {
        JobQueueTestSupport.parkOpenJobs(jdbcTemplate);
        tenantId = "tenant-" + UUID.randomUUID();
    }

    @Test
    void attachWaitsForAnInFlightStartAndThenRefuses() throws Exception {
        ResearchRun run = runService.createRun(tenantId, new CreateRunRequest("race", List.of()));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> start = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                runService.startRun(tenantId, run.id());
                started.countDown();
                await(release);
            }));
            assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

            Future<?> attach = executor.submit(() -> runService.attachSource(
                tenantId,
                run.id(),
                new AttachSourceRequest("text", "late", null, "Acme Solar Holdings", null)
            ));
            assertThatThrownBy(() -> attach.get(300, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            release.countDown();
            start.get(10, TimeUnit.SECONDS);
            assertThatThrownBy(() -> attach.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(PlanLockedException.class);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertThat(runService.listSources(tenantId, run.id())).isEmpty();
    }

    @Test
    void retryResumesAFailedRunFromItsFailedSteps() {
        ResearchRun run = runService.createRun(tenantId, new CreateRunRequest("retry", List.of()));
        runService.startRun(tenantId, run.id());
        jdbcTemplate.update(
            "UPDATE research_steps SET status = 'succeeded', attempt_count = 1 WHERE tenant_id = ? AND step_key <> ?",
            tenantId,
            StepKey.FINALIZE.key()
        );
        jdbcTemplate.update(
            "UPDATE research_steps SET status = 'failed', attempt_count = max_attempts WHERE tenant_id = ? AND step_key = ?",
            tenantId,
            StepKey.FINALIZE.key()
        );
        assertThat(workerService.runOnce("worker-retry").outcome()).isEqualTo(Outcome.FAILED);
        assertThat(runService.getRun(tenantId, run.id()).status()).isEqualTo(RunStatus.FAILED);

        ResearchJob retried = runService.retryRun(tenantId, run.id());

        assertThat(retried.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(runService.getRun(tenantId, run.id()).status()).isEqualTo(RunStatus.QUEUED);
        ResearchStep finalize = step(run.id(), StepKey.FINALIZE);
        assertThat(finalize.status()).isEqualTo(StepStatus.PENDING);
        assertThat(finalize.attemptCount()).isZero();
        assertThat(runService.listEvents(tenantId, run.id()))
            .extracting(ResearchEvent::eventType)
            .contains("run_failed", "run_retry");

        assertThat(workerService.runOnce("worker-retry").outcome()).isEqualTo(Outcome.SUCCEEDED);
        assertThat(runService.getRun(tenantId, run.id()).status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(step(run.id(), StepKey.FETCH_URL_SOURCES).attemptCount()).isEqualTo(1);
        assertThat(step(run.id(), StepKey.FINALIZE).status()).isEqualTo(StepStatus.SUCCEEDED);
    }

    @Test
    void onlyFailedRunsCanBeRetried() {
        ResearchRun run = runService.createRun(tenantId, new CreateRunRequest("not failed", List.of()));

        assertThatThrownBy(() -> runService.retryRun(tenantId, run.id()))
            .isInstanceOf(InvalidRunStateException.class)
            .hasMessageContaining("Only failed runs");
    }

    private ResearchStep step(UUID runId, StepKey key) {
        return runService.listSteps(tenantId, runId).stream()
            .filter(step -> step.stepKey().equals(key.key()))
            .findFirst()
            .orElseThrow();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
