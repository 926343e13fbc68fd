package com.delta.research.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record EnrichmentAssignmentRead(
    UUID id,
    String tenantId,
    String targetEntityType,
    UUID targetCanonicalId,
    String fieldKey,
    JsonNode value,
    String valueNormalized,
    double confidence,
    String derivedBy,
    UUID sourceDocumentId,
    String inputScopeHash,
    String contentHash,
    Instant createdAt,
    Instant updatedAt
) {
}
