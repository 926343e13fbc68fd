package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CreateRunRequest(
    String name,
    @JsonProperty("target_countries") List<String> targetCountries
) {
}
