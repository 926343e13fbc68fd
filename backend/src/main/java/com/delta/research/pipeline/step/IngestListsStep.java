package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.ProspectIngestionService;
import org.springframework.stereotype.Component;

@Component
public class IngestListsStep implements StepHandler {
    private final SourceDocumentRepository sourceRepository;
    private final ProspectIngestionService ingestionService;

    public IngestListsStep(SourceDocumentRepository sourceRepository, ProspectIngestionService ingestionService) {
        this.sourceRepository = sourceRepository;
        this.ingestionService = ingestionService;
    }

    @Override
    public StepKey key() {
        return StepKey.INGEST_LISTS;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        if (!sourceRepository.hasSources(context.tenantId(), context.runId(), SourceType.LIST)) {
            return StepOutcome.skipped("no_list_sources");
        }
        return StepOutcome.succeeded(StepSupport.output("lists", ingestionService.ingestLists(context)));
    }
}
