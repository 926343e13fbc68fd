package com.delta.research.pipeline.ranking;

import com.delta.research.pipeline.extract.EnrichmentRuleExtractor;
import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.EnrichmentAssignmentRead;
import com.delta.research.pipeline.model.EvidencePointer;
import com.delta.research.pipeline.model.RankedProspect;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository;
import com.delta.research.pipeline.persistence.EnrichmentAssignmentRepository;
import com.delta.research.pipeline.persistence.ProspectRepository;
import com.delta.research.pipeline.persistence.ResearchRunRepository;
import com.delta.research.pipeline.service.EnrichmentAssignmentService;
import com.delta.research.pipeline.service.ResourceNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Deterministic, explainable ordering of a run's company prospects. Every score component is
 * reported alongside the assignments that produced it.
 */
@Service
public class ProspectRankingService {
    static final BigDecimal WEIGHT_RELEVANCE = new BigDecimal("0.40");
    static final BigDecimal WEIGHT_EVIDENCE = new BigDecimal("0.30");
    static final BigDecimal WEIGHT_HQ_PRESENT = new BigDecimal("0.05");
    static final BigDecimal WEIGHT_HQ_TARGET = new BigDecimal("0.10");
    static final BigDecimal WEIGHT_OWNERSHIP = new BigDecimal("0.10");
    static final BigDecimal WEIGHT_INDUSTRY = new BigDecimal("0.10");
    static final int INDUSTRY_KEYWORD_CAP = 5;
    static final int SCALE = 6;

    public static final String COMPONENT_RELEVANCE = "relevance";
    public static final String COMPONENT_EVIDENCE = "evidence";

    private static final Comparator<EnrichmentAssignmentRead> BEST_ASSIGNMENT = Comparator
        .comparingDouble(EnrichmentAssignmentRead::confidence).reversed()
        .thenComparing(assignment -> String.valueOf(assignment.sourceDocumentId()))
        .thenComparing(EnrichmentAssignmentRead::contentHash);

    private final ResearchRunRepository runRepository;
    private final ProspectRepository prospectRepository;
    private final CanonicalEntityRepository canonicalRepository;
    private final EnrichmentAssignmentRepository assignmentRepository;

    public ProspectRankingService(
        ResearchRunRepository runRepository,
        ProspectRepository prospectRepository,
        CanonicalEntityRepository canonicalRepository,
        EnrichmentAssignmentRepository assignmentRepository
    ) {
        this.runRepository = runRepository;
        this.prospectRepository = prospectRepository;
        this.canonicalRepository = canonicalRepository;
        this.assignmentRepository = assignmentRepository;
    }

    public List<RankedProspect> rankRun(String tenantId, UUID runId) {
        ResearchRun run = runRepository.findRun(tenantId, runId);
        if (run == null) {
            throw new ResourceNotFoundException("Run not found: " + runId);
        }
        List<CompanyProspect> prospects = prospectRepository.listProspects(tenantId, runId);
        Map<UUID, UUID> links = canonicalRepository.companyLinksForRun(tenantId, runId);
        Map<UUID, TreeSet<String>> evidence = prospectRepository.evidenceSourceIdsByProspect(tenantId, runId);

        Map<UUID, Map<String, EnrichmentAssignmentRead>> bestByCompany = new LinkedHashMap<>();
        List<EnrichmentAssignmentRead> assignments = assignmentRepository.listForTargets(
            tenantId,
            EnrichmentAssignmentService.TARGET_COMPANY,
            new HashSet<>(links.values())
        );
        for (EnrichmentAssignmentRead assignment : assignments) {
            bestByCompany
                .computeIfAbsent(assignment.targetCanonicalId(), key -> new LinkedHashMap<>())
                .merge(assignment.fieldKey(), assignment, (left, right) -> BEST_ASSIGNMENT.compare(left, right) <= 0 ? left : right);
        }

        return rank(prospects, links, bestByCompany, evidence, run.config());
    }

    /**
     * Pure ranking over already loaded inputs.
     */
    static List<RankedProspect> rank(
        List<CompanyProspect> prospects,
        Map<UUID, UUID> links,
        Map<UUID, Map<String, EnrichmentAssignmentRead>> bestByCompany,
        Map<UUID, TreeSet<String>> evidence,
        RunConfig config
    ) {
        List<Scored> scored = new ArrayList<>();
        for (CompanyProspect prospect : prospects) {
            UUID canonicalId = links.get(prospect.id());
            Map<String, EnrichmentAssignmentRead> best = canonicalId == null
                ? Map.of()
                : bestByCompany.getOrDefault(canonicalId, Map.of());
            scored.add(score(prospect, canonicalId, best, evidence.get(prospect.id()), config));
        }
        scored.sort(
            Comparator.comparing(Scored::total).reversed()
                .thenComparing(item -> item.prospect().id().toString())
        );

        List<RankedProspect> ranked = new ArrayList<>();
        int rank = 1;
        for (Scored item : scored) {
            Map<String, Double> components = new LinkedHashMap<>();
            item.components().forEach((key, value) -> components.put(key, value.doubleValue()));
            ranked.add(new RankedProspect(
                rank++,
                item.prospect().id(),
                item.prospect().nameRaw(),
                item.canonicalId(),
                item.total().doubleValue(),
                components,
                item.whyIncluded(),
                item.evidenceIds(),
                item.hqCountry(),
                item.ownershipSignal(),
                item.industryKeywords()
            ));
        }
        return ranked;
    }

    private static Scored score(
        CompanyProspect prospect,
        UUID canonicalId,
        Map<String, EnrichmentAssignmentRead> best,
        TreeSet<String> evidence,
        RunConfig config
    ) {
        Map<String, BigDecimal> components = new LinkedHashMap<>();
        List<EvidencePointer> why = new ArrayList<>();
        components.put(COMPONENT_RELEVANCE, round(WEIGHT_RELEVANCE.multiply(BigDecimal.valueOf(prospect.relevanceScore()))));
        components.put(COMPONENT_EVIDENCE, round(WEIGHT_EVIDENCE.multiply(BigDecimal.valueOf(prospect.evidenceScore()))));

        String hqCountry = null;
        EnrichmentAssignmentRead hq = best.get(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY);
        if (hq != null) {
            hqCountry = textValue(hq.value());
            BigDecimal confidence = BigDecimal.valueOf(hq.confidence());
            BigDecimal value = WEIGHT_HQ_PRESENT.multiply(confidence);
            if (config.targetsCountry(hqCountry)) {
                value = value.add(WEIGHT_HQ_TARGET.multiply(confidence));
            }
            components.put(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY, round(value));
            why.add(new EvidencePointer(hq.fieldKey(), hq.sourceDocumentId()));
        }

        String ownershipSignal = null;
        EnrichmentAssignmentRead ownership = best.get(EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL);
        if (ownership != null) {
            ownershipSignal = textValue(ownership.value());
            components.put(
                EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL,
                round(WEIGHT_OWNERSHIP.multiply(BigDecimal.valueOf(ownership.confidence())))
            );
            why.add(new EvidencePointer(ownership.fieldKey(), ownership.sourceDocumentId()));
        }

        List<String> keywords = List.of();
        EnrichmentAssignmentRead industry = best.get(EnrichmentRuleExtractor.FIELD_INDUSTRY_KEYWORDS);
        if (industry != null) {
            keywords = listValue(industry.value());
            BigDecimal coverage = BigDecimal.valueOf(Math.min(keywords.size(), INDUSTRY_KEYWORD_CAP))
                .divide(BigDecimal.valueOf(INDUSTRY_KEYWORD_CAP), SCALE + 2, RoundingMode.HALF_UP);
            components.put(
                EnrichmentRuleExtractor.FIELD_INDUSTRY_KEYWORDS,
                round(WEIGHT_INDUSTRY.multiply(BigDecimal.valueOf(industry.confidence())).multiply(coverage))
            );
            why.add(new EvidencePointer(industry.fieldKey(), industry.sourceDocumentId()));
        }

        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : components.values()) {
            total = total.add(value);
        }
        List<UUID> evidenceIds = new ArrayList<>();
        if (evidence != null) {
            evidence.forEach(id -> evidenceIds.add(UUID.fromString(id)));
        }
        return new Scored(
            prospect,
            canonicalId,
            round(total),
            components,
            why,
            evidenceIds,
            hqCountry,
            ownershipSignal,
            keywords
        );
    }

    static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static String textValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static List<String> listValue(JsonNode value) {
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        value.forEach(node -> out.add(node.asText()));
        return out;
    }

    private record Scored(
        CompanyProspect prospect,
        UUID canonicalId,
        BigDecimal total,
        Map<String, BigDecimal> components,
        List<EvidencePointer> whyIncluded,
        List<UUID> evidenceIds,
        String hqCountry,
        String ownershipSignal,
        List<String> industryKeywords
    ) {
    }
}
