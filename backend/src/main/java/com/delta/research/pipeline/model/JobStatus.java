package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    QUEUED("queued"),
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    public static JobStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (JobStatus candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
