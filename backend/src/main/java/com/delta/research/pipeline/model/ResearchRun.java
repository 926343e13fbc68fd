package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record ResearchRun(
    UUID id,
    String tenantId,
    String name,
    RunStatus status,
    RunConfig config,
    Instant startedAt,
    Instant finishedAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt
) {
}
