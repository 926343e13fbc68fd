package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record ResearchJob(
    UUID id,
    String tenantId,
    UUID runId,
    String jobType,
    JobStatus status,
    int attemptCount,
    int maxAttempts,
    Instant nextRetryAt,
    Instant lockedAt,
    String lockedBy,
    boolean cancelRequested,
    String lastError,
    Instant createdAt,
    Instant updatedAt
) {
}
