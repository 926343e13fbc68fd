package com.delta.research.pipeline.service;

import com.delta.research.pipeline.extract.EnrichmentRuleExtractor;
import com.delta.research.pipeline.model.EnrichmentAssignmentCreate;
import com.delta.research.pipeline.model.EnrichmentAssignmentRead;
import com.delta.research.pipeline.model.ExtractedFact;
import com.delta.research.pipeline.model.QualityDecision;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository;
import com.delta.research.pipeline.persistence.ProspectRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Runs the rule extractor over the evidence documents of each canonical company reached by a run
 * and records every fact as an enrichment assignment.
 */
@Service
public class CompanyEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(CompanyEnrichmentService.class);

    public static final String DERIVED_BY = "company_enrichment_rules_v1";
    static final String INPUT_SCOPE_SALT = "company_enrichment_scope_v1";

    private final CanonicalEntityRepository canonicalRepository;
    private final ProspectRepository prospectRepository;
    private final SourceDocumentRepository sourceRepository;
    private final EnrichmentAssignmentService assignmentService;

    public CompanyEnrichmentService(
        CanonicalEntityRepository canonicalRepository,
        ProspectRepository prospectRepository,
        SourceDocumentRepository sourceRepository,
        EnrichmentAssignmentService assignmentService
    ) {
        this.canonicalRepository = canonicalRepository;
        this.prospectRepository = prospectRepository;
        this.sourceRepository = sourceRepository;
        this.assignmentService = assignmentService;
    }

    public EnrichmentSummary enrichRun(String tenantId, UUID runId) {
        Map<UUID, UUID> links = canonicalRepository.companyLinksForRun(tenantId, runId);
        Map<UUID, TreeSet<String>> evidenceByProspect = prospectRepository.evidenceSourceIdsByProspect(tenantId, runId);

        Map<String, TreeSet<String>> documentsByCompany = new TreeMap<>();
        for (Map.Entry<UUID, UUID> link : links.entrySet()) {
            TreeSet<String> evidence = evidenceByProspect.get(link.getKey());
            if (evidence == null) {
                continue;
            }
            documentsByCompany.computeIfAbsent(link.getValue().toString(), key -> new TreeSet<>()).addAll(evidence);
        }

        int documentsScanned = 0;
        int documentsSkipped = 0;
        int assignmentsRecorded = 0;
        for (Map.Entry<String, TreeSet<String>> entry : documentsByCompany.entrySet()) {
            UUID canonicalCompanyId = UUID.fromString(entry.getKey());
            for (String documentId : entry.getValue()) {
                SourceDocument source = sourceRepository.findSource(tenantId, UUID.fromString(documentId));
                if (!isUsable(source)) {
                    documentsSkipped++;
                    continue;
                }
                documentsScanned++;
                assignmentsRecorded += extractForDocument(tenantId, canonicalCompanyId, source).size();
            }
        }
        EnrichmentSummary summary = new EnrichmentSummary(
            documentsByCompany.size(),
            documentsScanned,
            documentsSkipped,
            assignmentsRecorded
        );
        log.info("Enrichment for run {}: {}", runId, summary);
        return summary;
    }

    public List<EnrichmentAssignmentRead> extractForDocument(String tenantId, UUID canonicalCompanyId, SourceDocument source) {
        List<ExtractedFact> facts = EnrichmentRuleExtractor.extract(source.contentText());
        if (facts.isEmpty()) {
            return List.of();
        }
        List<EnrichmentAssignmentCreate> payloads = new ArrayList<>();
        for (ExtractedFact fact : facts) {
            payloads.add(new EnrichmentAssignmentCreate(
                tenantId,
                EnrichmentAssignmentService.TARGET_COMPANY,
                canonicalCompanyId,
                fact.fieldKey(),
                fact.value(),
                fact.valueNormalized(),
                fact.confidence(),
                DERIVED_BY,
                source.id(),
                inputScopeHash(source.id(), fact.fieldKey())
            ));
        }
        return assignmentService.recordAssignments(payloads);
    }

    public static String inputScopeHash(UUID sourceDocumentId, String fieldKey) {
        return HashUtils.sha256Hex(INPUT_SCOPE_SALT + ":" + sourceDocumentId + ":" + fieldKey);
    }

    /**
     * Rejected, template-duplicate and content-duplicate documents never feed enrichment.
     */
    static boolean isUsable(SourceDocument source) {
        if (source == null || !source.hasContent() || source.isContentDuplicate()) {
            return false;
        }
        if (source.meta().isTemplateDuplicate()) {
            return false;
        }
        return source.meta().decision() != QualityDecision.REJECT;
    }

    public record EnrichmentSummary(
        int canonicalCompanies,
        int documentsScanned,
        int documentsSkipped,
        int assignmentsRecorded
    ) {
    }
}
