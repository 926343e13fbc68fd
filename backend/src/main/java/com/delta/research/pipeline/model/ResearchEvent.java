package com.delta.research.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record ResearchEvent(
    long id,
    String tenantId,
    UUID runId,
    String eventType,
    String status,
    JsonNode input,
    JsonNode output,
    String errorMessage,
    Instant createdAt
) {
}
