package com.delta.research.pipeline.model;

public record ResolutionSummary(
    int created,
    int matched,
    int linksCreated,
    int linksExisting,
    int conflictsSkipped,
    int evidenceMissingSkipped,
    int warningsMultiEvidence
) {
}
