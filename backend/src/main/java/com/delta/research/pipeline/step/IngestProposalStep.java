package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.ProspectIngestionService;
import org.springframework.stereotype.Component;

@Component
public class IngestProposalStep implements StepHandler {
    private final SourceDocumentRepository sourceRepository;
    private final ProspectIngestionService ingestionService;

    public IngestProposalStep(SourceDocumentRepository sourceRepository, ProspectIngestionService ingestionService) {
        this.sourceRepository = sourceRepository;
        this.ingestionService = ingestionService;
    }

    @Override
    public StepKey key() {
        return StepKey.INGEST_PROPOSAL;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        if (!sourceRepository.hasSources(context.tenantId(), context.runId(), SourceType.PROPOSAL)) {
            return StepOutcome.skipped("no_proposal_sources");
        }
        return StepOutcome.succeeded(StepSupport.output("proposals", ingestionService.ingestProposals(context)));
    }
}
