package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ResearchPlan(
    UUID id,
    String tenantId,
    UUID runId,
    int version,
    List<String> stepKeys,
    Instant lockedAt,
    Instant createdAt
) {
    public boolean isLocked() {
        return lockedAt != null;
    }
}
