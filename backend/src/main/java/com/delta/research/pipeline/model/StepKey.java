package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed, ordered steps of a research run plan. The enum order is the execution order.
 */
public enum StepKey {
    FETCH_URL_SOURCES("fetch_url_sources", 10),
    EXTRACT_URL_SOURCES("extract_url_sources", 20),
    CLASSIFY_SOURCES("classify_sources", 30),
    PROCESS_SOURCES("process_sources", 40),
    INGEST_LISTS("ingest_lists", 50),
    INGEST_PROPOSAL("ingest_proposal", 60),
    FINALIZE("finalize", 70);

    private final String key;
    private final int order;

    StepKey(String key, int order) {
        this.key = key;
        this.order = order;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int order() {
        return order;
    }

    /**
     * Returns null for keys this build does not know about.
     */
    public static StepKey fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (StepKey candidate : values()) {
            if (candidate.key.equals(key)) {
                return candidate;
            }
        }
        return null;
    }
}
