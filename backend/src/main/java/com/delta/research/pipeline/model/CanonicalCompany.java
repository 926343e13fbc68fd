package com.delta.research.pipeline.model;

import java.time.Instant;
import java.util.UUID;

public record CanonicalCompany(
    UUID id,
    String tenantId,
    String canonicalName,
    String primaryDomain,
    String countryCode,
    Instant createdAt
) {
}
