package com.delta.research.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record ResearchStep(
    UUID id,
    String tenantId,
    UUID runId,
    UUID planId,
    String stepKey,
    int stepOrder,
    StepStatus status,
    int attemptCount,
    int maxAttempts,
    Instant nextRetryAt,
    JsonNode input,
    JsonNode output,
    String lastError,
    Instant startedAt,
    Instant finishedAt
) {
    /**
     * A failed step that has used all of its attempts; it will never be claimed again.
     */
    public boolean isExhausted() {
        return status == StepStatus.FAILED && attemptCount >= maxAttempts;
    }

    public boolean isTerminal() {
        return status.isDone() || isExhausted();
    }

    public boolean isDue(Instant now) {
        return nextRetryAt == null || !nextRetryAt.isAfter(now);
    }
}
