package com.delta.research.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when a source is attached to a run whose plan has already been locked by a worker.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class PlanLockedException extends RuntimeException {
    private final UUID runId;

    public PlanLockedException(UUID runId) {
        super("Plan for run " + runId + " is locked; sources can no longer be attached");
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
