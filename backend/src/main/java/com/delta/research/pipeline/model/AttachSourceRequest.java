package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One attached source. {@code url} sources carry a URL, {@code pdf} sources base64 bytes, the other
 * types inline content.
 */
public record AttachSourceRequest(
    @JsonProperty("source_type") String sourceType,
    String title,
    String url,
    String content,
    @JsonProperty("content_base64") String contentBase64
) {
}
