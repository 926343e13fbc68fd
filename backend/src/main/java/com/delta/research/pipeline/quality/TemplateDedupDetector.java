package com.delta.research.pipeline.quality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Groups documents that share a template signature and elects one primary per group.
 */
public final class TemplateDedupDetector {
    private static final Comparator<Candidate> PRIMARY_ORDER = Comparator
        .comparingInt(Candidate::wordCount).reversed()
        .thenComparing(candidate -> candidate.id().toString());

    private TemplateDedupDetector() {
    }

    /**
     * Returns one membership per document that sits in a group of two or more, ordered by group key
     * with each group's primary first. Candidates without a signature or with zero words are ignored.
     */
    public static Map<UUID, Membership> detect(List<Candidate> candidates) {
        Map<String, List<Candidate>> groups = new TreeMap<>();
        for (Candidate candidate : candidates) {
            if (candidate.signaturePrefix() == null || candidate.wordCount() <= 0) {
                continue;
            }
            groups.computeIfAbsent(candidate.signaturePrefix(), key -> new ArrayList<>()).add(candidate);
        }

        Map<UUID, Membership> memberships = new LinkedHashMap<>();
        for (Map.Entry<String, List<Candidate>> group : groups.entrySet()) {
            List<Candidate> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            members.sort(PRIMARY_ORDER);
            UUID primaryId = members.get(0).id();
            for (Candidate member : members) {
                boolean duplicate = !member.id().equals(primaryId);
                memberships.put(member.id(), new Membership(group.getKey(), primaryId, duplicate));
            }
        }
        return memberships;
    }

    public record Candidate(UUID id, String signaturePrefix, int wordCount) {
    }

    public record Membership(String groupKey, UUID primaryId, boolean duplicate) {
    }
}
