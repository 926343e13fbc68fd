package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.SourceAcquisitionService;
import com.delta.research.pipeline.service.SourceAcquisitionService.FetchBatchSummary;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fetches the run's URL sources. Sources waiting on their own backoff keep the step retrying until
 * every source is fetched or exhausted; exhausted sources do not fail the step.
 */
@Component
public class FetchUrlSourcesStep implements StepHandler {
    private final SourceDocumentRepository sourceRepository;
    private final SourceAcquisitionService acquisitionService;

    public FetchUrlSourcesStep(SourceDocumentRepository sourceRepository, SourceAcquisitionService acquisitionService) {
        this.sourceRepository = sourceRepository;
        this.acquisitionService = acquisitionService;
    }

    @Override
    public StepKey key() {
        return StepKey.FETCH_URL_SOURCES;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        if (!sourceRepository.hasSources(context.tenantId(), context.runId(), SourceType.URL)) {
            return StepOutcome.skipped("no_url_sources");
        }
        FetchBatchSummary batch = acquisitionService.fetchUrlSources(context);
        Map<String, Object> output = StepSupport.output("fetch", batch);
        if (batch.remaining() > 0) {
            return StepOutcome.retry(StepSupport.secondsUntil(batch.nextRetryAt()), "sources_waiting_retry", output);
        }
        return StepOutcome.succeeded(output);
    }
}
