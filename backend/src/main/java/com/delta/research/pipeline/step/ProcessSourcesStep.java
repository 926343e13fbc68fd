package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.ProspectIngestionService;
import org.springframework.stereotype.Component;

@Component
public class ProcessSourcesStep implements StepHandler {
    private final SourceDocumentRepository sourceRepository;
    private final ProspectIngestionService ingestionService;

    public ProcessSourcesStep(SourceDocumentRepository sourceRepository, ProspectIngestionService ingestionService) {
        this.sourceRepository = sourceRepository;
        this.ingestionService = ingestionService;
    }

    @Override
    public StepKey key() {
        return StepKey.PROCESS_SOURCES;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        if (!StepSupport.hasDocuments(sourceRepository, context)) {
            return StepOutcome.skipped("no_documents");
        }
        return StepOutcome.succeeded(StepSupport.output("processing", ingestionService.processSources(context)));
    }
}
