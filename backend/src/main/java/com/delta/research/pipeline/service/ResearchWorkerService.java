package com.delta.research.pipeline.service;

import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.ResearchJobRepository;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import com.delta.research.pipeline.persistence.ResearchRunRepository;
import com.delta.research.pipeline.service.PlanService.StepClaim;
import com.delta.research.pipeline.step.StepContext;
import com.delta.research.pipeline.step.StepDispatcher;
import com.delta.research.pipeline.step.StepOutcome;
import com.delta.research.pipeline.util.BackoffPolicy;
import com.delta.research.pipeline.util.ErrorText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Claims research jobs and drives their runs through the step plan. One job is processed until it
 * finishes, is cancelled, or every remaining step waits on backoff.
 */
@Service
public class ResearchWorkerService {
    private static final Logger log = LoggerFactory.getLogger(ResearchWorkerService.class);

    private final ResearchJobRepository jobRepository;
    private final ResearchRunRepository runRepository;
    private final ResearchPlanRepository planRepository;
    private final ResearchEventRepository eventRepository;
    private final PlanService planService;
    private final StepDispatcher dispatcher;
    private final TransactionTemplate transactionTemplate;
    private final String workerId;

    public ResearchWorkerService(
        ResearchJobRepository jobRepository,
        ResearchRunRepository runRepository,
        ResearchPlanRepository planRepository,
        ResearchEventRepository eventRepository,
        PlanService planService,
        StepDispatcher dispatcher,
        TransactionTemplate transactionTemplate
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.planRepository = planRepository;
        this.eventRepository = eventRepository;
        this.planService = planService;
        this.dispatcher = dispatcher;
        this.transactionTemplate = transactionTemplate;
        this.workerId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Claims and processes at most one job. Returns what happened, or null when nothing was claimable.
     */
    public WorkerResult runOnce() {
        return runOnce(workerId);
    }

    public WorkerResult runOnce(String claimingWorkerId) {
        ResearchJob job = jobRepository.claimNextJob(claimingWorkerId);
        if (job == null) {
            return null;
        }
        log.info("Worker {} claimed job {} for run {}", claimingWorkerId, job.id(), job.runId());
        try {
            return processJob(job, claimingWorkerId);
        } catch (RuntimeException e) {
            String error = ErrorText.describe(e);
            log.warn("Job {} failed outside of a step", job.id(), e);
            int backoff = BackoffPolicy.backoffSeconds(job.attemptCount() + 1);
            boolean exhausted = jobRepository.markFailed(job.id(), error, backoff, false) == JobStatus.FAILED;
            if (exhausted && !runRepository.markFailed(job.tenantId(), job.runId(), error)) {
                runRepository.markCancelled(job.tenantId(), job.runId());
            }
            eventRepository.append(
                job.tenantId(),
                job.runId(),
                "worker_failed",
                "failed",
                jobPayload(job, claimingWorkerId),
                Map.of("terminal", exhausted),
                error
            );
            return new WorkerResult(job.id(), job.runId(), exhausted ? Outcome.FAILED : Outcome.REQUEUED);
        }
    }

    WorkerResult processJob(ResearchJob job, String claimingWorkerId) {
        ResearchRun run = runRepository.findRun(job.tenantId(), job.runId());
        if (run == null) {
            String error = "run_not_found";
            jobRepository.markFailed(job.id(), error, 0, true);
            eventRepository.append(
                job.tenantId(),
                job.runId(),
                "worker_failed",
                "failed",
                jobPayload(job, claimingWorkerId),
                null,
                error
            );
            log.warn("Job {} points at missing run {}", job.id(), job.runId());
            return new WorkerResult(job.id(), job.runId(), Outcome.FAILED);
        }
        if (isCancelRequested(job)) {
            return cancel(job, run, null, claimingWorkerId);
        }
        runRepository.markRunning(run.tenantId(), run.id());
        eventRepository.append(
            run.tenantId(),
            run.id(),
            "worker_claimed",
            "ok",
            jobPayload(job, claimingWorkerId),
            null,
            null
        );
        transactionTemplate.executeWithoutResult(status -> planService.lockPlanOnStart(run));

        while (true) {
            if (isCancelRequested(job)) {
                return cancel(job, run, null, claimingWorkerId);
            }
            StepClaim claim = planService.claimNextStep(run.tenantId(), run.id());
            if (claim.complete()) {
                return succeed(job, run, claimingWorkerId);
            }
            if (claim.failed()) {
                ResearchStep exhausted = claim.exhausted();
                String error = "step_exhausted: " + exhausted.stepKey()
                    + (exhausted.lastError() == null ? "" : " (" + exhausted.lastError() + ")");
                return failTerminally(job, run, exhausted, "step_exhausted", error, claimingWorkerId);
            }
            if (claim.step() == null) {
                Instant nextRetryAt = claim.waitUntil() == null ? Instant.now() : claim.waitUntil();
                jobRepository.requeue(job.id(), nextRetryAt);
                eventRepository.append(
                    run.tenantId(),
                    run.id(),
                    "worker_requeued",
                    "ok",
                    jobPayload(job, claimingWorkerId),
                    Map.of("next_retry_at", nextRetryAt.toString()),
                    null
                );
                return new WorkerResult(job.id(), run.id(), Outcome.REQUEUED);
            }

            ResearchStep step = claim.step();
            try {
                executeStep(run, step, job);
            } catch (RunCancelledException e) {
                return cancel(job, run, step, claimingWorkerId);
            } catch (TerminalRunFailureException e) {
                planRepository.markStepFailed(step.id(), e.getMessage(), null, null);
                stepEvent(run, step, "step_failed", "failed", e.getMessage());
                return failTerminally(job, run, step, e.getCode(), e.getMessage(), claimingWorkerId);
            } catch (RuntimeException e) {
                String error = ErrorText.describe(e);
                Instant nextRetryAt = BackoffPolicy.nextRetryAt(Instant.now(), step.attemptCount());
                planRepository.markStepFailed(step.id(), error, nextRetryAt, null);
                stepEvent(run, step, "step_failed", "failed", error);
                log.warn(
                    "Step {} of run {} failed (attempt {}/{})",
                    step.stepKey(),
                    run.id(),
                    step.attemptCount(),
                    step.maxAttempts(),
                    e
                );
            }
        }
    }

    private void executeStep(ResearchRun run, ResearchStep step, ResearchJob job) {
        StepContext context = new StepContext(run, step, job, () -> isCancelRequested(job));
        transactionTemplate.executeWithoutResult(status -> {
            StepOutcome outcome = dispatcher.dispatch(step.stepKey(), context);
            switch (outcome.kind()) {
                case SUCCEEDED -> {
                    planRepository.markStepSucceeded(step.id(), outcome.output());
                    stepEvent(run, step, "step_succeeded", "ok", null);
                }
                case SKIPPED -> {
                    planRepository.markStepSkipped(step.id(), outcome.output());
                    stepEvent(run, step, "step_skipped", "ok", outcome.reason());
                }
                case RETRY -> {
                    Instant nextRetryAt = Instant.now().plusSeconds(outcome.backoffSeconds());
                    planRepository.markStepFailed(step.id(), outcome.reason(), nextRetryAt, outcome.output());
                    stepEvent(run, step, "step_retry", "warn", outcome.reason());
                }
                default -> throw new IllegalStateException("Unhandled step outcome " + outcome.kind());
            }
        });
        log.debug("Step {} of run {} finished", step.stepKey(), run.id());
    }

    /**
     * The run is updated first: when a cancel landed after the last checkpoint the conditional update
     * fails and the cancel wins.
     */
    private WorkerResult succeed(ResearchJob job, ResearchRun run, String claimingWorkerId) {
        if (!runRepository.markSucceeded(run.tenantId(), run.id())) {
            return cancel(job, run, null, claimingWorkerId);
        }
        jobRepository.markSucceeded(job.id());
        eventRepository.append(
            run.tenantId(),
            run.id(),
            "run_succeeded",
            "ok",
            jobPayload(job, claimingWorkerId),
            null,
            null
        );
        log.info("Run {} succeeded", run.id());
        return new WorkerResult(job.id(), run.id(), Outcome.SUCCEEDED);
    }

    private WorkerResult failTerminally(
        ResearchJob job,
        ResearchRun run,
        ResearchStep step,
        String code,
        String error,
        String claimingWorkerId
    ) {
        if (!runRepository.markFailed(run.tenantId(), run.id(), error)) {
            return cancel(job, run, null, claimingWorkerId);
        }
        jobRepository.markFailed(job.id(), error, 0, true);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("code", code);
        output.put("step_key", step.stepKey());
        eventRepository.append(
            run.tenantId(),
            run.id(),
            "worker_failed",
            "failed",
            jobPayload(job, claimingWorkerId),
            output,
            error
        );
        eventRepository.append(run.tenantId(), run.id(), "run_failed", "failed", null, output, error);
        log.warn("Run {} failed terminally in step {}: {}", run.id(), step.stepKey(), error);
        return new WorkerResult(job.id(), run.id(), Outcome.FAILED);
    }

    private WorkerResult cancel(ResearchJob job, ResearchRun run, ResearchStep runningStep, String claimingWorkerId) {
        if (runningStep != null) {
            planRepository.markStepCancelled(runningStep.id());
        }
        int cancelledSteps = planRepository.cancelOpenSteps(run.tenantId(), run.id());
        jobRepository.markCancelled(job.id());
        runRepository.markCancelled(run.tenantId(), run.id());
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("cancelled_steps", cancelledSteps + (runningStep == null ? 0 : 1));
        if (runningStep != null) {
            output.put("step_key", runningStep.stepKey());
        }
        eventRepository.append(
            run.tenantId(),
            run.id(),
            "worker_cancelled",
            "cancelled",
            jobPayload(job, claimingWorkerId),
            output,
            null
        );
        log.info("Run {} cancelled", run.id());
        return new WorkerResult(job.id(), run.id(), Outcome.CANCELLED);
    }

    private boolean isCancelRequested(ResearchJob job) {
        return jobRepository.isCancelRequested(job.id()) || runRepository.isCancelRequested(job.tenantId(), job.runId());
    }

    private void stepEvent(ResearchRun run, ResearchStep step, String eventType, String status, String message) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("step_key", step.stepKey());
        input.put("attempt", step.attemptCount());
        eventRepository.append(run.tenantId(), run.id(), eventType, status, input, null, message);
    }

    private Map<String, Object> jobPayload(ResearchJob job, String claimingWorkerId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.id().toString());
        payload.put("worker_id", claimingWorkerId);
        payload.put("attempt", job.attemptCount());
        return payload;
    }

    public enum Outcome {
        SUCCEEDED,
        CANCELLED,
        FAILED,
        REQUEUED
    }

    public record WorkerResult(UUID jobId, UUID runId, Outcome outcome) {
    }
}
