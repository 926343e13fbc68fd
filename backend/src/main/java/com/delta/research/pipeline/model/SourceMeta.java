package com.delta.research.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Typed view of {@code source_documents.meta_json}. Each pipeline stage owns one section and
 * replaces it wholesale through the {@code withX} copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceMeta(
    FetchInfo fetch,
    ExtractionInfo extraction,
    QualityFlags quality,
    DedupeInfo dedupe,
    ProcessingInfo processing
) {
    public static SourceMeta empty() {
        return new SourceMeta(null, null, null, null, null);
    }

    public SourceMeta withFetch(FetchInfo value) {
        return new SourceMeta(value, extraction, quality, dedupe, processing);
    }

    public SourceMeta withExtraction(ExtractionInfo value, QualityFlags flags) {
        return new SourceMeta(fetch, value, flags, dedupe, processing);
    }

    public SourceMeta withDedupe(DedupeInfo value) {
        return new SourceMeta(fetch, extraction, quality, value, processing);
    }

    public SourceMeta withProcessing(ProcessingInfo value) {
        return new SourceMeta(fetch, extraction, quality, dedupe, value);
    }

    @JsonIgnore
    public boolean isTemplateDuplicate() {
        return dedupe != null && dedupe.duplicateTemplate();
    }

    @JsonIgnore
    public QualityDecision decision() {
        return extraction == null ? null : extraction.decision();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FetchInfo(
        Integer statusCode,
        String contentType,
        String finalUrl,
        String errorCode,
        String failureCategory,
        Long durationMs
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractionInfo(
        String version,
        String materialHash,
        String textHash,
        String signaturePrefix,
        String signatureTokens,
        int wordCount,
        int charCount,
        int lineCount,
        double uniqueTokenRatio,
        double alphaRatio,
        QualityDecision decision,
        List<String> reasonCodes,
        Instant extractedAt
    ) {
        public ExtractionInfo {
            reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QualityFlags(
        boolean paywallOrLogin,
        boolean errorPage,
        boolean thinContent,
        boolean boilerplateDominant,
        boolean unextractablePdf
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DedupeInfo(
        boolean duplicateTemplate,
        String templateGroupKey,
        UUID primarySourceId,
        UUID canonicalSourceId
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProcessingInfo(
        Instant processedAt,
        int companiesExtracted,
        int prospectsCreated,
        int executivesCreated,
        String error
    ) {
    }
}
