package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    QUEUED("queued"),
    RUNNING("running"),
    CANCEL_REQUESTED("cancel_requested"),
    CANCELLED("cancelled"),
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == SUCCEEDED || this == FAILED;
    }

    public static RunStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (RunStatus candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
