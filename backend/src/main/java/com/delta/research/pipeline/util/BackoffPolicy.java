package com.delta.research.pipeline.util;

import java.time.Instant;

/**
 * Linear backoff shared by jobs, steps and URL sources: 30s per attempt, capped at five minutes.
 */
public final class BackoffPolicy {
    public static final int STEP_SECONDS = 30;
    public static final int MAX_SECONDS = 300;

    private BackoffPolicy() {
    }

    public static int backoffSeconds(int attempt) {
        return Math.min(MAX_SECONDS, STEP_SECONDS * Math.max(1, attempt));
    }

    public static Instant nextRetryAt(Instant now, int attempt) {
        return now.plusSeconds(backoffSeconds(attempt));
    }
}
