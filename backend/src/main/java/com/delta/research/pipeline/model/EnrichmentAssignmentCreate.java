package com.delta.research.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record EnrichmentAssignmentCreate(
    String tenantId,
    String targetEntityType,
    UUID targetCanonicalId,
    String fieldKey,
    JsonNode value,
    String valueNormalized,
    double confidence,
    String derivedBy,
    UUID sourceDocumentId,
    String inputScopeHash
) {
}
