package com.delta.research.pipeline.service;

import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.model.RunStatus;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.model.StepStatus;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.ResearchJobRepository;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import com.delta.research.pipeline.persistence.ResearchRunRepository;
import com.delta.research.pipeline.service.PlanService.StepClaim;
import com.delta.research.pipeline.service.ResearchWorkerService.Outcome;
import com.delta.research.pipeline.service.ResearchWorkerService.WorkerResult;
import com.delta.research.pipeline.step.StepDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchWorkerServiceTest {
    private static final String TENANT = "tenant-a";
    private static final String WORKER = "worker-unit";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ResearchJobRepository jobRepository;
    @Mock
    private ResearchRunRepository runRepository;
    @Mock
    private ResearchPlanRepository planRepository;
    @Mock
    private ResearchEventRepository eventRepository;
    @Mock
    private PlanService planService;
    @Mock
    private StepDispatcher dispatcher;
    @Mock
    private TransactionTemplate transactionTemplate;

    private ResearchWorkerService workerService;
    private ResearchRun run;
    private ResearchJob job;

    @BeforeEach
    void setUp() {
        workerService = new ResearchWorkerService(
            jobRepository,
            runRepository,
            planRepository,
            eventRepository,
            planService,
            dispatcher,
            transactionTemplate
        );
        run = new ResearchRun(UUID.randomUUID(), TENANT, "worker", RunStatus.RUNNING, RunConfig.empty(), NOW, null, null, NOW, NOW);
        job = new ResearchJob(
            UUID.randomUUID(),
            TENANT,
            run.id(),
            "company_research_run",
            JobStatus.RUNNING,
            0,
            5,
            null,
            NOW,
            WORKER,
            false,
            null,
            NOW,
            NOW
        );
        when(jobRepository.claimNextJob(WORKER)).thenReturn(job);
        when(runRepository.findRun(TENANT, run.id())).thenReturn(run);
    }

    @Test
    void cancelLandingAfterTheLastCheckpointWinsOverSuccess() {
        when(planService.claimNextStep(TENANT, run.id())).thenReturn(StepClaim.completed());
        when(runRepository.markSucceeded(TENANT, run.id())).thenReturn(false);

        WorkerResult result = workerService.runOnce(WORKER);

        assertThat(result.outcome()).isEqualTo(Outcome.CANCELLED);
        verify(runRepository).markCancelled(TENANT, run.id());
        verify(jobRepository).markCancelled(job.id());
        verify(jobRepository, never()).markSucceeded(any());
        verify(eventRepository).append(eq(TENANT), eq(run.id()), eq("worker_cancelled"), eq("cancelled"), any(), any(), any());
        verify(eventRepository, never()).append(any(), any(), eq("run_succeeded"), any(), any(), any(), any());
    }

    @Test
    void exhaustedFinalizeFailsTheJobAndTheRun() {
        ResearchStep finalize = step(StepKey.FINALIZE, StepStatus.FAILED, 3, "boom");
        when(planService.claimNextStep(TENANT, run.id())).thenReturn(StepClaim.failed(finalize));
        when(runRepository.markFailed(eq(TENANT), eq(run.id()), contains("finalize"))).thenReturn(true);

        WorkerResult result = workerService.runOnce(WORKER);

        assertThat(result.outcome()).isEqualTo(Outcome.FAILED);
        verify(jobRepository).markFailed(eq(job.id()), contains("boom"), eq(0), eq(true));
        verify(eventRepository).append(eq(TENANT), eq(run.id()), eq("run_failed"), eq("failed"), any(), any(), contains("finalize"));
        verify(jobRepository, never()).markSucceeded(any());
    }

    @Test
    void cancelLandingBeforeATerminalFailureWinsOverTheFailure() {
        ResearchStep finalize = step(StepKey.FINALIZE, StepStatus.FAILED, 3, null);
        when(planService.claimNextStep(TENANT, run.id())).thenReturn(StepClaim.failed(finalize));
        when(runRepository.markFailed(eq(TENANT), eq(run.id()), anyString())).thenReturn(false);

        WorkerResult result = workerService.runOnce(WORKER);

        assertThat(result.outcome()).isEqualTo(Outcome.CANCELLED);
        verify(runRepository).markCancelled(TENANT, run.id());
        verify(jobRepository).markCancelled(job.id());
        verify(jobRepository, never()).markFailed(any(), anyString(), anyInt(), anyBoolean());
        verify(eventRepository, never()).append(any(), any(), eq("run_failed"), any(), any(), any(), any());
    }

    private ResearchStep step(StepKey key, StepStatus status, int attempts, String lastError) {
        return new ResearchStep(
            UUID.randomUUID(),
            TENANT,
            run.id(),
            UUID.randomUUID(),
            key.key(),
            key.ordinal(),
            status,
            attempts,
            3,
            null,
            null,
            null,
            lastError,
            NOW,
            NOW
        );
    }
}
