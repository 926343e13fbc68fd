package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.SourceQualityService;
import org.springframework.stereotype.Component;

@Component
public class ClassifySourcesStep implements StepHandler {
    private final SourceDocumentRepository sourceRepository;
    private final SourceQualityService qualityService;

    public ClassifySourcesStep(SourceDocumentRepository sourceRepository, SourceQualityService qualityService) {
        this.sourceRepository = sourceRepository;
        this.qualityService = qualityService;
    }

    @Override
    public StepKey key() {
        return StepKey.CLASSIFY_SOURCES;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        if (!StepSupport.hasDocuments(sourceRepository, context)) {
            return StepOutcome.skipped("no_documents");
        }
        return StepOutcome.succeeded(StepSupport.output("templates", qualityService.classifySources(context)));
    }
}
