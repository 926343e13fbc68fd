package com.delta.research.pipeline.service;

import com.delta.research.config.ResearchProperties;
import com.delta.research.pipeline.model.ResearchPlan;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.model.StepStatus;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Materializes the fixed step plan of a run and hands out the next step to execute.
 */
@Service
public class PlanService {
    public static final int PLAN_VERSION = 1;

    private final ResearchPlanRepository planRepository;
    private final ResearchProperties properties;

    public PlanService(ResearchPlanRepository planRepository, ResearchProperties properties) {
        this.planRepository = planRepository;
        this.properties = properties;
    }

    /**
     * Idempotent: steps that already exist keep their state.
     */
    public ResearchPlan ensurePlanAndSteps(ResearchRun run) {
        List<String> keys = new ArrayList<>();
        for (StepKey key : StepKey.values()) {
            keys.add(key.key());
        }
        ResearchPlan plan = planRepository.ensurePlan(run.tenantId(), run.id(), PLAN_VERSION, keys);
        for (StepKey key : StepKey.values()) {
            planRepository.insertStepIfAbsent(
                run.tenantId(),
                run.id(),
                plan.id(),
                key.key(),
                key.order(),
                maxAttempts(key),
                Map.of("step_key", key.key())
            );
        }
        return plan;
    }

    /**
     * Locks the plan the first time a run starts. Returns true only for the call that locked it.
     */
    public boolean lockPlanOnStart(ResearchRun run) {
        ResearchPlan plan = ensurePlanAndSteps(run);
        if (plan.lockedAt() != null) {
            return false;
        }
        return planRepository.lockPlan(plan.id());
    }

    /**
     * Keeps the plan row locked for the rest of the caller's transaction; a concurrent start waits
     * until the caller commits.
     */
    public boolean isPlanLocked(String tenantId, UUID runId) {
        ResearchPlan plan = planRepository.findPlanForUpdate(tenantId, runId);
        return plan != null && plan.lockedAt() != null;
    }

    /**
     * Walks the steps in order. Terminal steps are passed over; the first open step is claimed when
     * due, otherwise it blocks everything after it. An exhausted {@code finalize} step fails the run
     * right away; any other exhausted step fails it once nothing else is left to run.
     */
    public StepClaim claimNextStep(String tenantId, UUID runId) {
        Instant now = Instant.now();
        ResearchStep exhausted = null;
        for (ResearchStep step : planRepository.listSteps(tenantId, runId)) {
            if (step.isExhausted()) {
                if (StepKey.FINALIZE.key().equals(step.stepKey())) {
                    return StepClaim.failed(step);
                }
                if (exhausted == null) {
                    exhausted = step;
                }
                continue;
            }
            if (step.isTerminal()) {
                continue;
            }
            if (step.status() == StepStatus.RUNNING) {
                return StepClaim.waiting(now.plusSeconds(1));
            }
            if (!step.isDue(now)) {
                return StepClaim.waiting(step.nextRetryAt());
            }
            if (planRepository.claimStep(step.id())) {
                return StepClaim.claimed(planRepository.findStep(step.id()));
            }
            return StepClaim.waiting(now.plusSeconds(1));
        }
        return exhausted == null ? StepClaim.completed() : StepClaim.failed(exhausted);
    }

    int maxAttempts(StepKey key) {
        int stepMax = properties.getPlan().getStepMaxAttempts();
        if (key == StepKey.FETCH_URL_SOURCES) {
            return Math.max(stepMax, properties.getSources().getMaxAttempts() + 1);
        }
        return stepMax;
    }

    /**
     * Exactly one of: a claimed step, a wait, completion, or an exhausted step that fails the run.
     */
    public record StepClaim(ResearchStep step, Instant waitUntil, boolean complete, ResearchStep exhausted) {
        static StepClaim claimed(ResearchStep step) {
            return new StepClaim(step, null, false, null);
        }

        static StepClaim waiting(Instant waitUntil) {
            return new StepClaim(null, waitUntil, false, null);
        }

        static StepClaim completed() {
            return new StepClaim(null, null, true, null);
        }

        static StepClaim failed(ResearchStep exhausted) {
            return new StepClaim(null, null, false, exhausted);
        }

        public boolean failed() {
            return exhausted != null;
        }
    }
}
