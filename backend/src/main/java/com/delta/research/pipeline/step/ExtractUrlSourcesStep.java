package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.SourceAcquisitionService;
import com.delta.research.pipeline.service.SourceQualityService;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads pasted text and PDFs, then scores every acquired document.
 */
@Component
public class ExtractUrlSourcesStep implements StepHandler {
    private final SourceDocumentRepository sourceRepository;
    private final SourceAcquisitionService acquisitionService;
    private final SourceQualityService qualityService;

    public ExtractUrlSourcesStep(
        SourceDocumentRepository sourceRepository,
        SourceAcquisitionService acquisitionService,
        SourceQualityService qualityService
    ) {
        this.sourceRepository = sourceRepository;
        this.acquisitionService = acquisitionService;
        this.qualityService = qualityService;
    }

    @Override
    public StepKey key() {
        return StepKey.EXTRACT_URL_SOURCES;
    }

    @Override
    public StepOutcome execute(StepContext context) {
        if (!StepSupport.hasDocuments(sourceRepository, context)) {
            return StepOutcome.skipped("no_documents");
        }
        Map<String, Object> output = StepSupport.output("local", acquisitionService.acquireLocalSources(context));
        output.put("scoring", qualityService.scoreSources(context));
        return StepOutcome.succeeded(output);
    }
}
