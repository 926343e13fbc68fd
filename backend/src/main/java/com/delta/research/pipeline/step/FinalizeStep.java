package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import com.delta.research.pipeline.resolution.CanonicalCompanyResolver;
import com.delta.research.pipeline.resolution.CanonicalPeopleResolver;
import com.delta.research.pipeline.service.CompanyEnrichmentService;
import com.delta.research.pipeline.service.TerminalRunFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Barrier step. Waits until every other step is done, then resolves canonical entities and records
 * enrichment assignments for the run.
 */
@Component
public class FinalizeStep implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(FinalizeStep.class);
    static final int BLOCKED_BACKOFF_SECONDS = 30;

    private final ResearchPlanRepository planRepository;
    private final CanonicalPeopleResolver peopleResolver;
    private final CanonicalCompanyResolver companyResolver;
    private final CompanyEnrichmentService enrichmentService;

    public FinalizeStep(
        ResearchPlanRepository planRepository,
        CanonicalPeopleResolver peopleResolver,
        CanonicalCompanyResolver companyResolver,
        CompanyEnrichmentService enrichmentService
    ) {
        this.planRepository = planRepository;
        this.peopleResolver = peopleResolver;
        this.companyResolver = companyResolver;
        this.enrichmentService = enrichmentService;
    }

    @Override
    public StepKey key() {
        return StepKey.FINALIZE;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        List<String> waiting = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ResearchStep step : planRepository.listSteps(context.tenantId(), context.runId())) {
            if (StepKey.FINALIZE.key().equals(step.stepKey()) || step.status().isDone()) {
                continue;
            }
            if (step.isExhausted()) {
                failed.add(step.stepKey());
            } else {
                waiting.add(step.stepKey());
            }
        }
        if (!failed.isEmpty()) {
            throw new TerminalRunFailureException(
                "blocked_by_failed_step",
                "blocked_by:" + String.join(",", failed)
            );
        }
        if (!waiting.isEmpty()) {
            String reason = "blocked_by:" + String.join(",", waiting);
            return StepOutcome.retry(BLOCKED_BACKOFF_SECONDS, reason, StepSupport.output("blocked_by", waiting));
        }

        context.checkpoint();
        Map<String, Object> output = StepSupport.output(
            "people",
            peopleResolver.resolveRun(context.tenantId(), context.runId())
        );
        context.checkpoint();
        output.put("companies", companyResolver.resolveRun(context.tenantId(), context.runId()));
        context.checkpoint();
        output.put("enrichment", enrichmentService.enrichRun(context.tenantId(), context.runId()));
        log.info("Finalized run {}: {}", context.runId(), output);
        return StepOutcome.succeeded(output);
    }
}
