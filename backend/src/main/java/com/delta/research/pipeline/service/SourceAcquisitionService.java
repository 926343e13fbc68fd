package com.delta.research.pipeline.service;

import com.delta.research.pipeline.extract.HtmlTextDistiller;
import com.delta.research.pipeline.extract.PdfTextExtractor;
import com.delta.research.pipeline.http.FetchFailureClassifier;
import com.delta.research.pipeline.http.ResearchHttpClient;
import com.delta.research.pipeline.model.HttpFetchResult;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceMeta;
import com.delta.research.pipeline.model.SourceMeta.DedupeInfo;
import com.delta.research.pipeline.model.SourceMeta.FetchInfo;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.step.StepContext;
import com.delta.research.pipeline.util.BackoffPolicy;
import com.delta.research.pipeline.util.ErrorText;
import com.delta.research.pipeline.util.HashUtils;
import com.delta.research.pipeline.util.TextNormalizer;
import com.delta.research.pipeline.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns attached sources into stored text: URL sources are fetched with per-source retry, pasted
 * text and uploaded PDFs are read in place. Every acquired document gets a content hash; a document
 * whose hash another source of the run already holds is linked to it and skipped downstream.
 */
@Service
public class SourceAcquisitionService {
    private static final Logger log = LoggerFactory.getLogger(SourceAcquisitionService.class);

    static final String MIME_TEXT = "text/plain";
    static final String MIME_PDF = "application/pdf";

    private final SourceDocumentRepository sourceRepository;
    private final ResearchEventRepository eventRepository;
    private final ResearchHttpClient httpClient;
    private final TransactionTemplate perSource;

    public SourceAcquisitionService(
        SourceDocumentRepository sourceRepository,
        ResearchEventRepository eventRepository,
        ResearchHttpClient httpClient,
        PlatformTransactionManager transactionManager
    ) {
        this.sourceRepository = sourceRepository;
        this.eventRepository = eventRepository;
        this.httpClient = httpClient;
        this.perSource = new TransactionTemplate(transactionManager);
        this.perSource.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    public FetchBatchSummary fetchUrlSources(StepContext context) {
        String tenantId = context.tenantId();
        UUID runId = context.runId();
        int succeeded = 0;
        int cached = 0;
        int retryScheduled = 0;
        int exhausted = 0;
        for (SourceDocument source : sourceRepository.listFetchableUrlSources(tenantId, runId, Instant.now())) {
            context.checkpoint();
            FetchResult result;
            try {
                result = perSource.execute(status -> fetchOne(tenantId, source));
            } catch (RuntimeException e) {
                if (e instanceof RunCancelledException) {
                    throw e;
                }
                log.warn("Fetching source {} failed unexpectedly", source.id(), e);
                int attempt = source.attemptCount() + 1;
                result = recordFetchFailure(tenantId, source, attempt, ErrorText.describe(e), null, null, source.meta(), null);
            }
            switch (result) {
                case SUCCEEDED -> succeeded++;
                case CACHED -> cached++;
                case RETRY_SCHEDULED -> retryScheduled++;
                case EXHAUSTED -> exhausted++;
                default -> {
                }
            }
        }
        FetchBatchSummary summary = new FetchBatchSummary(
            succeeded,
            cached,
            retryScheduled,
            exhausted,
            sourceRepository.countRetryableUrlSources(tenantId, runId),
            sourceRepository.nextUrlRetryAt(tenantId, runId)
        );
        log.info("URL fetch batch for run {}: {}", runId, summary);
        return summary;
    }

    FetchResult fetchOne(String tenantId, SourceDocument source) {
        if (source.hasContent()) {
            return FetchResult.CACHED;
        }
        UUID runId = source.runId();
        sourceRepository.markFetching(source.id());
        int attempt = source.attemptCount() + 1;

        String canonicalUrl;
        try {
            canonicalUrl = UrlCanonicalizer.canonicalize(source.url());
        } catch (IllegalArgumentException e) {
            String error = "canonicalize_failed: " + e.getMessage();
            sourceRepository.recordFailure(source.id(), SourceStatus.FAILED, error, null, null, null, source.meta());
            eventRepository.append(tenantId, runId, "canonicalize", "failed", sourcePayload(source), null, error);
            eventRepository.append(tenantId, runId, "fetch_failed", "failed", sourcePayload(source), null, error);
            log.warn("Source {} has an unusable URL {}: {}", source.id(), source.url(), e.getMessage());
            return FetchResult.EXHAUSTED;
        }

        HttpFetchResult response = httpClient.get(canonicalUrl);
        FetchInfo fetchInfo = new FetchInfo(
            response.statusCode() > 0 ? response.statusCode() : null,
            response.contentType(),
            response.finalUri() == null ? null : response.finalUri().toString(),
            response.errorCode(),
            response.isSuccessful() ? null : FetchFailureClassifier.classify(response),
            response.duration() == null ? null : response.duration().toMillis()
        );
        SourceMeta meta = source.meta().withFetch(fetchInfo);
        Integer statusCode = fetchInfo.statusCode();

        String failure = null;
        if (!response.isSuccessful()) {
            failure = FetchFailureClassifier.errorKey(response)
                + (response.errorMessage() == null ? "" : ": " + response.errorMessage());
        } else {
            try {
                Acquired acquired = decode(response);
                if (acquired.text() == null || acquired.text().isBlank()) {
                    failure = "empty_text";
                } else {
                    storeContent(
                        tenantId,
                        source,
                        canonicalUrl,
                        acquired,
                        statusCode,
                        response.finalUrlOrRequested(),
                        meta
                    );
                    eventRepository.append(
                        tenantId,
                        runId,
                        "fetch_succeeded",
                        "ok",
                        sourcePayload(source),
                        Map.of("url_normalized", canonicalUrl, "status_code", response.statusCode()),
                        null
                    );
                    return FetchResult.SUCCEEDED;
                }
            } catch (IOException e) {
                failure = (response.isPdf() ? "pdf_unparsable: " : "html_unreadable: ") + ErrorText.describe(e);
            }
        }

        return recordFetchFailure(
            tenantId,
            source,
            attempt,
            failure,
            statusCode,
            response.finalUri() == null ? null : response.finalUri().toString(),
            meta,
            fetchInfo.failureCategory()
        );
    }

    /**
     * Consumes one attempt of the source: schedules a retry with backoff, or fails the source for
     * good once its attempts are used up.
     */
    private FetchResult recordFetchFailure(
        String tenantId,
        SourceDocument source,
        int attempt,
        String failure,
        Integer statusCode,
        String finalUrl,
        SourceMeta meta,
        String failureCategory
    ) {
        UUID runId = source.runId();
        boolean terminal = attempt >= source.maxAttempts();
        Instant nextRetryAt = terminal ? null : BackoffPolicy.nextRetryAt(Instant.now(), attempt);
        sourceRepository.recordFailure(
            source.id(),
            terminal ? SourceStatus.FAILED : SourceStatus.FETCH_FAILED,
            failure,
            nextRetryAt,
            statusCode,
            finalUrl,
            meta
        );
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("attempt", attempt);
        output.put("max_attempts", source.maxAttempts());
        output.put("failure_category", failureCategory);
        eventRepository.append(tenantId, runId, "fetch_failed", "failed", sourcePayload(source), output, failure);
        if (terminal) {
            eventRepository.append(tenantId, runId, "retry_exhausted", "failed", sourcePayload(source), output, failure);
            log.warn("Source {} exhausted {} fetch attempts: {}", source.id(), attempt, failure);
            return FetchResult.EXHAUSTED;
        }
        output.put("next_retry_at", nextRetryAt.toString());
        eventRepository.append(tenantId, runId, "retry_scheduled", "warn", sourcePayload(source), output, failure);
        log.info("Source {} fetch attempt {} failed ({}), retry at {}", source.id(), attempt, failure, nextRetryAt);
        return FetchResult.RETRY_SCHEDULED;
    }

    /**
     * Reads pasted text and uploaded PDFs that have not been acquired yet.
     */
    public LocalAcquisitionSummary acquireLocalSources(StepContext context) {
        String tenantId = context.tenantId();
        UUID runId = context.runId();
        int acquired = 0;
        int failed = 0;
        for (SourceType type : new SourceType[] {SourceType.TEXT, SourceType.PDF}) {
            for (SourceDocument source : sourceRepository.listSources(tenantId, runId, type)) {
                if (source.status() != SourceStatus.NEW) {
                    continue;
                }
                context.checkpoint();
                if (acquireLocal(tenantId, source)) {
                    acquired++;
                } else {
                    failed++;
                }
            }
        }
        return new LocalAcquisitionSummary(acquired, failed);
    }

    boolean acquireLocal(String tenantId, SourceDocument source) {
        Acquired acquired;
        if (source.sourceType() == SourceType.TEXT) {
            String text = TextNormalizer.normalizePastedText(source.contentText());
            if (text.isBlank()) {
                return failLocal(tenantId, source, "empty_text");
            }
            acquired = new Acquired(text, null, MIME_TEXT, null, HashUtils.sha256Hex(text));
        } else {
            byte[] bytes = source.contentBytes();
            if (bytes == null || bytes.length == 0) {
                return failLocal(tenantId, source, "pdf_bytes_missing");
            }
            try {
                PdfTextExtractor.PdfText pdf = PdfTextExtractor.extract(bytes);
                acquired = new Acquired(pdf.text(), bytes, MIME_PDF, null, HashUtils.sha256Hex(bytes));
            } catch (IOException e) {
                return failLocal(tenantId, source, "pdf_unparsable: " + ErrorText.describe(e));
            }
        }
        storeContent(tenantId, source, null, acquired, null, null, source.meta());
        eventRepository.append(
            tenantId,
            source.runId(),
            "source_acquired",
            "ok",
            sourcePayload(source),
            Map.of("content_hash", acquired.contentHash()),
            null
        );
        return true;
    }

    private boolean failLocal(String tenantId, SourceDocument source, String error) {
        sourceRepository.recordFailure(source.id(), SourceStatus.FAILED, error, null, null, null, source.meta());
        eventRepository.append(tenantId, source.runId(), "source_acquired", "failed", sourcePayload(source), null, error);
        log.warn("Source {} ({}) could not be read: {}", source.id(), source.sourceType().value(), error);
        return false;
    }

    private void storeContent(
        String tenantId,
        SourceDocument source,
        String urlNormalized,
        Acquired acquired,
        Integer statusCode,
        String finalUrl,
        SourceMeta meta
    ) {
        sourceRepository.recordContent(
            source.id(),
            urlNormalized,
            acquired.title(),
            acquired.text(),
            acquired.bytes(),
            acquired.mimeType(),
            acquired.contentHash(),
            statusCode,
            finalUrl,
            meta
        );
        SourceDocument first = sourceRepository.findFirstWithContentHash(
            tenantId,
            source.runId(),
            acquired.contentHash(),
            source.id()
        );
        if (first == null) {
            return;
        }
        sourceRepository.linkContentDuplicate(
            source.id(),
            first.id(),
            meta.withDedupe(new DedupeInfo(false, null, null, first.id()))
        );
        eventRepository.append(
            tenantId,
            source.runId(),
            "canonical_dedupe",
            "ok",
            sourcePayload(source),
            Map.of("canonical_source_id", first.id().toString()),
            null
        );
        log.debug("Source {} duplicates the content of {}", source.id(), first.id());
    }

    private Acquired decode(HttpFetchResult response) throws IOException {
        byte[] body = response.bodyBytes() == null ? new byte[0] : response.bodyBytes();
        if (response.isPdf()) {
            PdfTextExtractor.PdfText pdf = PdfTextExtractor.extract(body);
            return new Acquired(pdf.text(), body, MIME_PDF, null, HashUtils.sha256Hex(body));
        }
        HtmlTextDistiller.Distilled distilled = HtmlTextDistiller.distill(
            body,
            response.contentType(),
            response.finalUrlOrRequested()
        );
        String text = distilled.text();
        return new Acquired(
            text,
            null,
            response.contentType(),
            distilled.title(),
            text == null ? null : HashUtils.sha256Hex(text)
        );
    }

    private Map<String, Object> sourcePayload(SourceDocument source) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source_id", source.id().toString());
        payload.put("source_type", source.sourceType().value());
        if (source.url() != null) {
            payload.put("url", source.url());
        }
        return payload;
    }

    enum FetchResult {
        SUCCEEDED,
        CACHED,
        RETRY_SCHEDULED,
        EXHAUSTED
    }

    private record Acquired(String text, byte[] bytes, String mimeType, String title, String contentHash) {
    }

    public record FetchBatchSummary(
        int succeeded,
        int cached,
        int retryScheduled,
        int exhausted,
        int remaining,
        Instant nextRetryAt
    ) {
    }

    public record LocalAcquisitionSummary(int acquired, int failed) {
    }
}
