package com.delta.research.pipeline.model;

import java.util.UUID;

public record EvidencePointer(String fieldKey, UUID sourceDocumentId) {
    public String asCsvToken() {
        return fieldKey + ":" + sourceDocumentId;
    }
}
