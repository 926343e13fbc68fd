package com.delta.research.pipeline.service;

import com.delta.research.pipeline.extract.CompanyNameExtractor;
import com.delta.research.pipeline.extract.CompanyNameExtractor.CompanyMention;
import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.ExecutiveProspect;
import com.delta.research.pipeline.model.QualityDecision;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceMeta;
import com.delta.research.pipeline.model.SourceMeta.ProcessingInfo;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.ProspectRepository;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.resolution.EntityNormalizer;
import com.delta.research.pipeline.step.StepContext;
import com.delta.research.pipeline.util.ErrorText;
import com.delta.research.pipeline.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns acquired documents, pasted lists and structured proposals into company and executive
 * prospects with evidence rows pointing back at the source.
 */
@Service
public class ProspectIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ProspectIngestionService.class);

    static final double DEFAULT_RELEVANCE = 0.5;
    static final double DEFAULT_EVIDENCE = 0.5;
    static final double EVIDENCE_WEIGHT = 1.0;

    private final SourceDocumentRepository sourceRepository;
    private final ProspectRepository prospectRepository;
    private final ResearchEventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate perDocument;

    public ProspectIngestionService(
        SourceDocumentRepository sourceRepository,
        ProspectRepository prospectRepository,
        ResearchEventRepository eventRepository,
        ObjectMapper objectMapper,
        PlatformTransactionManager transactionManager
    ) {
        this.sourceRepository = sourceRepository;
        this.prospectRepository = prospectRepository;
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        // one savepoint per document: a failing document rolls back alone and the step carries on
        this.perDocument = new TransactionTemplate(transactionManager);
        this.perDocument.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    public IngestionSummary processSources(StepContext context) {
        String tenantId = context.tenantId();
        IngestionSummary.Builder summary = new IngestionSummary.Builder();
        for (SourceDocument source : sourceRepository.listSources(tenantId, context.runId())) {
            if (!isProcessable(source)) {
                continue;
            }
            context.checkpoint();
            try {
                List<CompanyMention> mentions = CompanyNameExtractor.extract(source.contentText());
                perDocument.executeWithoutResult(status -> ingestMentions(tenantId, source, mentions, summary));
            } catch (RuntimeException e) {
                if (e instanceof RunCancelledException) {
                    throw e;
                }
                recordFailure(tenantId, source, e, summary);
            }
        }
        return summary.build();
    }

    public IngestionSummary ingestLists(StepContext context) {
        String tenantId = context.tenantId();
        IngestionSummary.Builder summary = new IngestionSummary.Builder();
        for (SourceDocument source : sourceRepository.listSources(tenantId, context.runId(), SourceType.LIST)) {
            if (source.status() != SourceStatus.NEW) {
                continue;
            }
            context.checkpoint();
            try {
                String text = TextNormalizer.normalizePastedText(source.contentText());
                List<CompanyMention> mentions = CompanyNameExtractor.extract(text);
                perDocument.executeWithoutResult(status -> ingestMentions(tenantId, source, mentions, summary));
            } catch (RuntimeException e) {
                if (e instanceof RunCancelledException) {
                    throw e;
                }
                recordFailure(tenantId, source, e, summary);
            }
        }
        return summary.build();
    }

    public IngestionSummary ingestProposals(StepContext context) {
        String tenantId = context.tenantId();
        IngestionSummary.Builder summary = new IngestionSummary.Builder();
        for (SourceDocument source : sourceRepository.listSources(tenantId, context.runId(), SourceType.PROPOSAL)) {
            if (source.status() != SourceStatus.NEW) {
                continue;
            }
            context.checkpoint();
            JsonNode root;
            try {
                root = objectMapper.readTree(source.contentText() == null ? "" : source.contentText());
            } catch (JsonProcessingException e) {
                String error = "invalid_proposal_json: " + e.getOriginalMessage();
                sourceRepository.recordFailure(source.id(), SourceStatus.FAILED, error, null, null, null, source.meta());
                eventRepository.append(tenantId, source.runId(), "ingest_proposal", "failed", sourcePayload(source), null, error);
                log.warn("Proposal source {} is not valid JSON: {}", source.id(), e.getOriginalMessage());
                summary.failed++;
                continue;
            }
            try {
                perDocument.executeWithoutResult(status -> ingestProposal(tenantId, source, root, summary));
            } catch (RuntimeException e) {
                if (e instanceof RunCancelledException) {
                    throw e;
                }
                recordFailure(tenantId, source, e, summary);
            }
        }
        return summary.build();
    }

    private void ingestMentions(
        String tenantId,
        SourceDocument source,
        List<CompanyMention> mentions,
        IngestionSummary.Builder summary
    ) {
        int created = 0;
        for (CompanyMention mention : mentions) {
            if (addProspect(tenantId, source, mention.name(), mention.normalizedName(), mention.snippet())) {
                created++;
            }
        }
        finish(tenantId, source, mentions.size(), created, 0, summary);
    }

    private void ingestProposal(String tenantId, SourceDocument source, JsonNode root, IngestionSummary.Builder summary) {
        int companies = 0;
        int created = 0;
        int executives = 0;
        for (JsonNode company : root.path("companies")) {
            String name = TextNormalizer.collapseWhitespace(company.path("name").asText(""));
            String normalized = TextNormalizer.normalizeCompanyName(name);
            if (normalized.isEmpty()) {
                continue;
            }
            companies++;
            if (addProspect(tenantId, source, name, normalized, name)) {
                created++;
            }
            CompanyProspect prospect = prospectRepository.findProspectByName(tenantId, source.runId(), normalized);
            prospectRepository.fillProspectDetails(
                prospect.id(),
                textOrNull(company, "website_url"),
                textOrNull(company, "hq_country")
            );
            for (JsonNode executive : company.path("executives")) {
                String executiveName = TextNormalizer.collapseWhitespace(executive.path("name").asText(""));
                String executiveNormalized = EntityNormalizer.personName(executiveName);
                if (executiveNormalized == null) {
                    continue;
                }
                ExecutiveProspect stored = prospectRepository.findOrCreateExecutive(
                    tenantId,
                    source.runId(),
                    prospect.id(),
                    executiveName,
                    executiveNormalized,
                    textOrNull(executive, "title"),
                    EntityNormalizer.email(textOrNull(executive, "email")),
                    textOrNull(executive, "linkedin_url"),
                    source.id()
                );
                prospectRepository.addExecutiveEvidence(tenantId, stored.id(), source.id(), executiveName + " | " + name);
                executives++;
            }
        }
        finish(tenantId, source, companies, created, executives, summary);
    }

    /**
     * Returns true when the prospect did not exist in the run before.
     */
    private boolean addProspect(String tenantId, SourceDocument source, String name, String normalized, String snippet) {
        boolean existed = prospectRepository.findProspectByName(tenantId, source.runId(), normalized) != null;
        CompanyProspect prospect = prospectRepository.findOrCreateProspect(
            tenantId,
            source.runId(),
            name,
            normalized,
            DEFAULT_RELEVANCE,
            DEFAULT_EVIDENCE
        );
        prospectRepository.addProspectEvidence(
            tenantId,
            prospect.id(),
            source.id(),
            source.sourceType().value(),
            source.title() != null ? source.title() : source.url(),
            source.url(),
            snippet,
            EVIDENCE_WEIGHT
        );
        return !existed;
    }

    private void finish(
        String tenantId,
        SourceDocument source,
        int companies,
        int created,
        int executives,
        IngestionSummary.Builder summary
    ) {
        ProcessingInfo processing = new ProcessingInfo(Instant.now(), companies, created, executives, null);
        sourceRepository.markProcessed(source.id(), source.meta().withProcessing(processing));
        summary.processed++;
        summary.companies += companies;
        summary.prospectsCreated += created;
        summary.executives += executives;
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("companies_extracted", companies);
        output.put("prospects_created", created);
        output.put("executives", executives);
        eventRepository.append(tenantId, source.runId(), "process_source", "ok", sourcePayload(source), output, null);
        log.debug("Source {} yielded {} companies ({} new)", source.id(), companies, created);
    }

    private void recordFailure(String tenantId, SourceDocument source, RuntimeException e, IngestionSummary.Builder summary) {
        String error = ErrorText.describe(e);
        log.warn("Processing failed for source {}", source.id(), e);
        SourceMeta meta = source.meta().withProcessing(new ProcessingInfo(Instant.now(), 0, 0, 0, error));
        sourceRepository.recordProcessingError(source.id(), error, meta);
        eventRepository.append(tenantId, source.runId(), "process_source", "failed", sourcePayload(source), null, error);
        summary.failed++;
    }

    /**
     * Acquired documents that passed quality and dedup and have not been processed yet.
     */
    static boolean isProcessable(SourceDocument source) {
        if (!source.sourceType().isDocument() || source.status() != SourceStatus.FETCHED) {
            return false;
        }
        if (!source.hasContent() || source.isContentDuplicate() || source.meta().isTemplateDuplicate()) {
            return false;
        }
        QualityDecision decision = source.meta().decision();
        return decision != null && decision != QualityDecision.REJECT;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Map<String, Object> sourcePayload(SourceDocument source) {
        return Map.of("source_id", source.id().toString(), "source_type", source.sourceType().value());
    }

    public record IngestionSummary(
        int processed,
        int failed,
        int companies,
        int prospectsCreated,
        int executives
    ) {
        static final class Builder {
            int processed;
            int failed;
            int companies;
            int prospectsCreated;
            int executives;

            IngestionSummary build() {
                return new IngestionSummary(processed, failed, companies, prospectsCreated, executives);
            }
        }
    }
}
