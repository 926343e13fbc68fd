package com.delta.research.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ExtractedFact(
    String fieldKey,
    JsonNode value,
    String valueNormalized,
    double confidence,
    String matchedRule
) {
}
