package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record CompanyProspect(
    UUID id,
    String tenantId,
    UUID runId,
    String nameRaw,
    String nameNormalized,
    String websiteUrl,
    String hqCountry,
    double relevanceScore,
    double evidenceScore,
    String status,
    Instant createdAt
) {
}
