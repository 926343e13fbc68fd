package com.delta.research.pipeline.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RankedProspect(
    int rank,
    UUID prospectId,
    String companyName,
    UUID canonicalCompanyId,
    double computedScore,
    Map<String, Double> scoreComponents,
    List<EvidencePointer> whyIncluded,
    List<UUID> evidenceSourceDocumentIds,
    String hqCountry,
    String ownershipSignal,
    List<String> industryKeywords
) {
}
