package com.delta.research.pipeline.resolution;

import com.delta.research.pipeline.model.ResolutionSummary;

import java.util.Collection;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Mutable counters for one resolution pass, plus the shared evidence choice rule.
 */
final class ResolutionTally {
    int created;
    int matched;
    int linksCreated;
    int linksExisting;
    int conflictsSkipped;
    int evidenceMissingSkipped;
    int warningsMultiEvidence;

    /**
     * Lowest evidence id in lexical order, or null (counted as missing evidence) when there is none.
     */
    UUID chooseEvidence(Collection<UUID> evidenceIds) {
        TreeSet<String> ordered = new TreeSet<>();
        for (UUID id : evidenceIds) {
            if (id != null) {
                ordered.add(id.toString());
            }
        }
        if (ordered.isEmpty()) {
            evidenceMissingSkipped++;
            conflictsSkipped++;
            return null;
        }
        if (ordered.size() > 1) {
            warningsMultiEvidence++;
        }
        return UUID.fromString(ordered.first());
    }

    void recordLink(boolean inserted) {
        if (inserted) {
            linksCreated++;
        } else {
            linksExisting++;
        }
    }

    ResolutionSummary toSummary() {
        return new ResolutionSummary(
            created,
            matched,
            linksCreated,
            linksExisting,
            conflictsSkipped,
            evidenceMissingSkipped,
            warningsMultiEvidence
        );
    }
}
