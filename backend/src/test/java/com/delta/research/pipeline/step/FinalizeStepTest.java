package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.ResolutionSummary;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.model.RunStatus;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.model.StepStatus;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import com.delta.research.pipeline.resolution.CanonicalCompanyResolver;
import com.delta.research.pipeline.resolution.CanonicalPeopleResolver;
import com.delta.research.pipeline.service.CompanyEnrichmentService;
import com.delta.research.pipeline.service.CompanyEnrichmentService.EnrichmentSummary;
import com.delta.research.pipeline.service.TerminalRunFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinalizeStepTest {
    private static final String TENANT = "tenant-a";

    @Mock
    private ResearchPlanRepository planRepository;
    @Mock
    private CanonicalPeopleResolver peopleResolver;
    @Mock
    private CanonicalCompanyResolver companyResolver;
    @Mock
    private CompanyEnrichmentService enrichmentService;

    private FinalizeStep step;
    private ResearchRun run;
    private StepContext context;

    @BeforeEach
    void setUp() {
        step = new FinalizeStep(planRepository, peopleResolver, companyResolver, enrichmentService);
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        run = new ResearchRun(UUID.randomUUID(), TENANT, "finalize", RunStatus.RUNNING, RunConfig.empty(), now, null, null, now, now);
        context = new StepContext(run, null, null, () -> false);
    }

    @Test
    void resolvesAndEnrichesOnceEveryOtherStepIsDone() {
        ResolutionSummary empty = new ResolutionSummary(0, 0, 0, 0, 0, 0, 0);
        ResolutionSummary companies = new ResolutionSummary(3, 0, 3, 0, 0, 0, 0);
        when(planRepository.listSteps(TENANT, run.id())).thenReturn(List.of(
            step(StepKey.FETCH_URL_SOURCES, StepStatus.SUCCEEDED, 1),
            step(StepKey.INGEST_LISTS, StepStatus.SKIPPED, 1),
            step(StepKey.FINALIZE, StepStatus.RUNNING, 1)
        ));
        when(peopleResolver.resolveRun(TENANT, run.id())).thenReturn(empty);
        when(companyResolver.resolveRun(TENANT, run.id())).thenReturn(companies);
        when(enrichmentService.enrichRun(TENANT, run.id())).thenReturn(new EnrichmentSummary(3, 1, 0, 2));

        StepOutcome outcome = step.execute(context);

        assertThat(outcome.kind()).isEqualTo(StepOutcome.Kind.SUCCEEDED);
        assertThat(outcome.output()).containsEntry("companies", companies);
        verify(enrichmentService).enrichRun(TENANT, run.id());
    }

    @Test
    void waitsWhileAnEarlierStepCanStillRetry() {
        when(planRepository.listSteps(TENANT, run.id())).thenReturn(List.of(
            step(StepKey.FETCH_URL_SOURCES, StepStatus.FAILED, 1),
            step(StepKey.FINALIZE, StepStatus.RUNNING, 1)
        ));

        StepOutcome outcome = step.execute(context);

        assertThat(outcome.kind()).isEqualTo(StepOutcome.Kind.RETRY);
        assertThat(outcome.reason()).isEqualTo("blocked_by:fetch_url_sources");
        assertThat(outcome.backoffSeconds()).isEqualTo(FinalizeStep.BLOCKED_BACKOFF_SECONDS);
        verifyNoInteractions(companyResolver, peopleResolver, enrichmentService);
    }

    @Test
    void exhaustedStepFailsTheRun() {
        when(planRepository.listSteps(TENANT, run.id())).thenReturn(List.of(
            step(StepKey.PROCESS_SOURCES, StepStatus.FAILED, 3),
            step(StepKey.FINALIZE, StepStatus.RUNNING, 1)
        ));

        assertThatThrownBy(() -> step.execute(context))
            .isInstanceOf(TerminalRunFailureException.class)
            .hasMessage("blocked_by:process_sources")
            .extracting(error -> ((TerminalRunFailureException) error).getCode())
            .isEqualTo("blocked_by_failed_step");
        verifyNoInteractions(companyResolver, peopleResolver, enrichmentService);
    }

    private ResearchStep step(StepKey key, StepStatus status, int attempts) {
        return new ResearchStep(
            UUID.randomUUID(),
            TENANT,
            run.id(),
            UUID.randomUUID(),
            key.key(),
            key.order(),
            status,
            attempts,
            3,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }
}
