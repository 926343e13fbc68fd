package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

public record SourceDocument(
    UUID id,
    String tenantId,
    UUID runId,
    SourceType sourceType,
    SourceStatus status,
    String title,
    String url,
    String urlNormalized,
    String contentText,
    @JsonIgnore byte[] contentBytes,
    String mimeType,
    String contentHash,
    int attemptCount,
    int maxAttempts,
    Instant nextRetryAt,
    String lastError,
    Integer httpStatusCode,
    String httpFinalUrl,
    UUID canonicalSourceId,
    SourceMeta meta,
    Instant fetchedAt,
    Instant createdAt,
    Instant updatedAt
) {
    public SourceDocument {
        meta = meta == null ? SourceMeta.empty() : meta;
    }

    public boolean hasContent() {
        return contentHash != null && contentText != null && !contentText.isBlank();
    }

    public boolean isContentDuplicate() {
        return canonicalSourceId != null;
    }

    public boolean hasAttemptsLeft() {
        return attemptCount < maxAttempts;
    }
}
