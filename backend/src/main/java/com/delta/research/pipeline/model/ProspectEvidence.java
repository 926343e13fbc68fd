package com.delta.research.pipeline.model;

import java.util.UUID;

public record ProspectEvidence(
    UUID id,
    UUID companyProspectId,
    UUID sourceDocumentId,
    String sourceType,
    String sourceName,
    String sourceUrl,
    String snippet,
    double weight
) {
}
