package com.delta.research.pipeline.service;

import java.util.UUID;

/**
 * Raised at a cancellation checkpoint; unwinds the current step so the worker can record the
 * cancellation.
 */
public class RunCancelledException extends RuntimeException {
    public RunCancelledException(UUID runId) {
        super("Run " + runId + " was cancelled");
    }
}
