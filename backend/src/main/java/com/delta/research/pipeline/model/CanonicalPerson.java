package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record CanonicalPerson(
    UUID id,
    String tenantId,
    String canonicalFullName,
    String primaryEmail,
    String primaryLinkedinUrl,
    Instant createdAt
) {
}
