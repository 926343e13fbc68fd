package com.delta.research.pipeline.service;

import com.delta.research.pipeline.model.QualityDecision;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceMeta;
import com.delta.research.pipeline.model.SourceMeta.DedupeInfo;
import com.delta.research.pipeline.model.SourceMeta.ExtractionInfo;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.quality.QualityClassifier;
import com.delta.research.pipeline.quality.QualityClassifier.QualityReport;
import com.delta.research.pipeline.quality.TemplateDedupDetector;
import com.delta.research.pipeline.step.StepContext;
import com.delta.research.pipeline.util.ErrorText;
import com.delta.research.pipeline.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;

@Service
public class SourceQualityService {
    private static final Logger log = LoggerFactory.getLogger(SourceQualityService.class);

    private final SourceDocumentRepository sourceRepository;
    private final ResearchEventRepository eventRepository;
    private final TransactionTemplate perDocument;

    public SourceQualityService(
        SourceDocumentRepository sourceRepository,
        ResearchEventRepository eventRepository,
        PlatformTransactionManager transactionManager
    ) {
        this.sourceRepository = sourceRepository;
        this.eventRepository = eventRepository;
        this.perDocument = new TransactionTemplate(transactionManager);
        this.perDocument.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * Scores every acquired document of the run. Documents whose material and extractor version
     * are unchanged since the last pass keep their record.
     */
    public ScoringSummary scoreSources(StepContext context) {
        String tenantId = context.tenantId();
        UUID runId = context.runId();
        int scored = 0;
        int unchanged = 0;
        int rejected = 0;
        int flagged = 0;
        for (SourceDocument source : scorableSources(tenantId, runId)) {
            context.checkpoint();
            String materialHash = materialHash(source);
            ExtractionInfo previous = source.meta().extraction();
            if (previous != null
                && QualityClassifier.EXTRACTION_VERSION.equals(previous.version())
                && Objects.equals(materialHash, previous.materialHash())) {
                unchanged++;
                eventRepository.append(
                    tenantId,
                    runId,
                    "extract_source_content",
                    "ok",
                    Map.of("source_id", source.id().toString()),
                    Map.of("skipped", "already_extracted"),
                    null
                );
                continue;
            }
            try {
                QualityReport report = perDocument.execute(status -> scoreSource(tenantId, runId, source, materialHash));
                scored++;
                if (report.decision() == QualityDecision.REJECT) {
                    rejected++;
                } else if (report.decision() == QualityDecision.FLAG) {
                    flagged++;
                }
            } catch (RuntimeException e) {
                if (e instanceof RunCancelledException) {
                    throw e;
                }
                log.warn("Quality scoring failed for source {}", source.id(), e);
                sourceRepository.recordProcessingError(source.id(), ErrorText.describe(e), source.meta());
                eventRepository.append(
                    tenantId,
                    runId,
                    "extract_source_content",
                    "failed",
                    Map.of("source_id", source.id().toString()),
                    null,
                    ErrorText.describe(e)
                );
            }
        }
        ScoringSummary summary = new ScoringSummary(scored, unchanged, rejected, flagged);
        log.info("Quality scoring for run {}: {}", runId, summary);
        return summary;
    }

    private QualityReport scoreSource(String tenantId, UUID runId, SourceDocument source, String materialHash) {
        QualityReport report = QualityClassifier.classify(
            source.sourceType(),
            source.title(),
            source.contentText(),
            isBlankPdf(source),
            materialHash,
            Instant.now()
        );
        sourceRepository.updateMeta(source.id(), source.meta().withExtraction(report.extraction(), report.flags()));
        String status = switch (report.decision()) {
            case REJECT -> "failed";
            case FLAG -> "warn";
            case ACCEPT -> "ok";
        };
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("decision", report.decision().value());
        output.put("reason_codes", report.extraction().reasonCodes());
        output.put("word_count", report.extraction().wordCount());
        eventRepository.append(
            tenantId,
            runId,
            "extract_source_content",
            status,
            Map.of("source_id", source.id().toString()),
            output,
            null
        );
        return report;
    }

    /**
     * Groups scored documents by template signature and marks every non-primary member. Members
     * that left a group lose their duplicate flag again.
     */
    public TemplateSummary classifySources(StepContext context) {
        String tenantId = context.tenantId();
        UUID runId = context.runId();
        List<SourceDocument> scored = new ArrayList<>();
        List<TemplateDedupDetector.Candidate> candidates = new ArrayList<>();
        for (SourceDocument source : scorableSources(tenantId, runId)) {
            ExtractionInfo extraction = source.meta().extraction();
            if (extraction == null) {
                continue;
            }
            scored.add(source);
            candidates.add(new TemplateDedupDetector.Candidate(
                source.id(),
                extraction.signaturePrefix(),
                extraction.wordCount()
            ));
        }
        Map<UUID, TemplateDedupDetector.Membership> memberships = TemplateDedupDetector.detect(candidates);

        int duplicates = 0;
        int changed = 0;
        TreeSet<String> groups = new TreeSet<>();
        for (SourceDocument source : scored) {
            context.checkpoint();
            TemplateDedupDetector.Membership membership = memberships.get(source.id());
            boolean duplicate = membership != null && membership.duplicate();
            if (membership != null) {
                groups.add(membership.groupKey());
            }
            if (duplicate) {
                duplicates++;
            }
            SourceMeta updated = applyMembership(source.meta(), membership);
            if (!updated.equals(source.meta())) {
                sourceRepository.updateMeta(source.id(), updated);
                changed++;
                if (duplicate) {
                    eventRepository.append(
                        tenantId,
                        runId,
                        "template_duplicate",
                        "warn",
                        Map.of("source_id", source.id().toString()),
                        Map.of("primary_source_id", membership.primaryId().toString(), "group_key", membership.groupKey()),
                        null
                    );
                }
            }
        }
        TemplateSummary summary = new TemplateSummary(scored.size(), groups.size(), duplicates, changed);
        log.info("Template dedup for run {}: {}", runId, summary);
        return summary;
    }

    static SourceMeta applyMembership(SourceMeta meta, TemplateDedupDetector.Membership membership) {
        ExtractionInfo extraction = meta.extraction();
        boolean duplicate = membership != null && membership.duplicate();
        TreeSet<String> reasons = new TreeSet<>(extraction.reasonCodes());
        if (duplicate) {
            reasons.add(QualityClassifier.FLAG_DUPLICATE_TEMPLATE);
        } else {
            reasons.remove(QualityClassifier.FLAG_DUPLICATE_TEMPLATE);
        }
        ExtractionInfo updatedExtraction = new ExtractionInfo(
            extraction.version(),
            extraction.materialHash(),
            extraction.textHash(),
            extraction.signaturePrefix(),
            extraction.signatureTokens(),
            extraction.wordCount(),
            extraction.charCount(),
            extraction.lineCount(),
            extraction.uniqueTokenRatio(),
            extraction.alphaRatio(),
            QualityClassifier.decide(reasons),
            new ArrayList<>(reasons),
            extraction.extractedAt()
        );
        DedupeInfo previous = meta.dedupe();
        UUID canonicalSourceId = previous == null ? null : previous.canonicalSourceId();
        DedupeInfo dedupe;
        if (membership != null) {
            dedupe = new DedupeInfo(duplicate, membership.groupKey(), membership.primaryId(), canonicalSourceId);
        } else if (canonicalSourceId != null) {
            dedupe = new DedupeInfo(false, null, null, canonicalSourceId);
        } else {
            dedupe = null;
        }
        return meta.withExtraction(updatedExtraction, meta.quality()).withDedupe(dedupe);
    }

    private List<SourceDocument> scorableSources(String tenantId, UUID runId) {
        List<SourceDocument> out = new ArrayList<>();
        for (SourceDocument source : sourceRepository.listSources(tenantId, runId)) {
            if (source.sourceType().isDocument() && source.contentHash() != null && !source.isContentDuplicate()) {
                out.add(source);
            }
        }
        return out;
    }

    private static boolean isBlankPdf(SourceDocument source) {
        return source.sourceType() == SourceType.PDF
            && (source.contentText() == null || source.contentText().isBlank());
    }

    static String materialHash(SourceDocument source) {
        if (source.contentBytes() != null && source.contentBytes().length > 0) {
            return HashUtils.sha256Hex(source.contentBytes());
        }
        return HashUtils.sha256Hex(source.contentText() == null ? "" : source.contentText());
    }

    public record ScoringSummary(int scored, int unchanged, int rejected, int flagged) {
    }

    public record TemplateSummary(int documents, int groups, int duplicates, int changed) {
    }
}
