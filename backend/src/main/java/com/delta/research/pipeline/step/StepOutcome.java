package com.delta.research.pipeline.step;

import java.util.Map;

public record StepOutcome(Kind kind, Map<String, Object> output, int backoffSeconds, String reason) {
    public enum Kind {
        SUCCEEDED,
        SKIPPED,
        RETRY
    }

    public static StepOutcome succeeded(Map<String, Object> output) {
        return new StepOutcome(Kind.SUCCEEDED, output, 0, null);
    }

    public static StepOutcome skipped(String reason) {
        return new StepOutcome(Kind.SKIPPED, Map.of("reason", reason), 0, reason);
    }

    /**
     * Work remains but cannot proceed before {@code backoffSeconds}; recorded as a failed attempt.
     */
    public static StepOutcome retry(int backoffSeconds, String reason, Map<String, Object> output) {
        return new StepOutcome(Kind.RETRY, output, Math.max(1, backoffSeconds), reason);
    }
}
