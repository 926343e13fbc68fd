package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceStatus {
    NEW("new"),
    QUEUED("queued"),
    FETCHING("fetching"),
    FETCHED("fetched"),
    PROCESSED("processed"),
    FAILED("failed"),
    FETCH_FAILED("fetch_failed");

    private final String value;

    SourceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean hasContent() {
        return this == FETCHED || this == PROCESSED;
    }

    public static SourceStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SourceStatus candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown source status: " + value);
    }
}
