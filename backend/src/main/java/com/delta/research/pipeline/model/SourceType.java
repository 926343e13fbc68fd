package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    URL("url"),
    TEXT("text"),
    PDF("pdf"),
    LIST("list"),
    PROPOSAL("proposal");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isDocument() {
        return this == URL || this == TEXT || this == PDF;
    }

    public static SourceType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SourceType candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
