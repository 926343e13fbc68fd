package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Link from a run-scoped raw entity (company prospect or executive) to its canonical entity.
 */
public record CanonicalLink(
    UUID id,
    String tenantId,
    UUID canonicalId,
    UUID entityId,
    String matchRule,
    UUID evidenceSourceDocumentId,
    UUID evidenceRunId,
    Instant createdAt
) {
}
