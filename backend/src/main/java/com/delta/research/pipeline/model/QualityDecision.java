package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QualityDecision {
    ACCEPT("accept"),
    FLAG("flag"),
    REJECT("reject");

    private final String value;

    QualityDecision(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static QualityDecision fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (QualityDecision candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown quality decision: " + value);
    }
}
