package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record ExecutiveProspect(
    UUID id,
    String tenantId,
    UUID runId,
    UUID companyProspectId,
    String nameRaw,
    String nameNormalized,
    String title,
    String email,
    String linkedinUrl,
    UUID sourceDocumentId,
    Instant createdAt
) {
}
