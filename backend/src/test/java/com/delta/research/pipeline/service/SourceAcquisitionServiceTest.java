package com.delta.research.pipeline.service;

import com.delta.research.pipeline.http.ResearchHttpClient;
import com.delta.research.pipeline.model.HttpFetchResult;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.model.RunStatus;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceMeta;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.SourceAcquisitionService.FetchBatchSummary;
import com.delta.research.pipeline.step.StepContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceAcquisitionServiceTest {
    private static final String TENANT = "tenant-a";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String BROKEN_URL = "https://broken.example.com/list";
    private static final String HEALTHY_URL = "https://healthy.example.com/list";

    @Mock
    private SourceDocumentRepository sourceRepository;
    @Mock
    private ResearchEventRepository eventRepository;
    @Mock
    private ResearchHttpClient httpClient;
    @Mock
    private PlatformTransactionManager transactionManager;

    private SourceAcquisitionService service;
    private ResearchRun run;
    private StepContext context;

    @BeforeEach
    void setUp() {
        service = new SourceAcquisitionService(sourceRepository, eventRepository, httpClient, transactionManager);
        run = new ResearchRun(UUID.randomUUID(), TENANT, "fetch", RunStatus.RUNNING, RunConfig.empty(), NOW, null, null, NOW, NOW);
        context = new StepContext(run, null, null, () -> false);
        when(httpClient.get(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.contains("broken")) {
                throw new IllegalStateException("connection pool closed");
            }
            return latinPage(url);
        });
    }

    @Test
    void unexpectedErrorInOneSourceSchedulesItsRetryAndSiblingsStillFetch() {
        SourceDocument broken = urlSource(BROKEN_URL, 0);
        SourceDocument healthy = urlSource(HEALTHY_URL, 0);
        when(sourceRepository.listFetchableUrlSources(eq(TENANT), eq(run.id()), any())).thenReturn(List.of(broken, healthy));

        FetchBatchSummary summary = service.fetchUrlSources(context);

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.retryScheduled()).isEqualTo(1);
        assertThat(summary.exhausted()).isZero();
        verify(transactionManager).rollback(any());
        verify(sourceRepository).recordFailure(
            eq(broken.id()),
            eq(SourceStatus.FETCH_FAILED),
            contains("connection pool closed"),
            notNull(),
            isNull(),
            isNull(),
            any()
        );
        verify(eventRepository).append(eq(TENANT), eq(run.id()), eq("retry_scheduled"), eq("warn"), any(), any(), contains("connection pool closed"));
        verify(sourceRepository).recordContent(
            eq(healthy.id()),
            anyString(),
            eq("Fournisseurs"),
            contains("Société Générale Énergie"),
            isNull(),
            anyString(),
            anyString(),
            eq(200),
            anyString(),
            any()
        );
        verify(sourceRepository, never()).recordContent(eq(broken.id()), any(), any(), any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    void unexpectedErrorOnTheLastAttemptFailsTheSource() {
        SourceDocument broken = urlSource(BROKEN_URL, 2);
        when(sourceRepository.listFetchableUrlSources(eq(TENANT), eq(run.id()), any())).thenReturn(List.of(broken));

        FetchBatchSummary summary = service.fetchUrlSources(context);

        assertThat(summary.exhausted()).isEqualTo(1);
        verify(sourceRepository).recordFailure(
            eq(broken.id()),
            eq(SourceStatus.FAILED),
            contains("connection pool closed"),
            isNull(),
            isNull(),
            isNull(),
            any()
        );
        verify(eventRepository).append(eq(TENANT), eq(run.id()), eq("retry_exhausted"), eq("failed"), any(), any(), anyString());
    }

    private SourceDocument urlSource(String url, int attempts) {
        return new SourceDocument(
            UUID.randomUUID(),
            TENANT,
            run.id(),
            SourceType.URL,
            attempts == 0 ? SourceStatus.QUEUED : SourceStatus.FETCH_FAILED,
            null,
            url,
            null,
            null,
            null,
            null,
            null,
            attempts,
            3,
            null,
            null,
            null,
            null,
            null,
            SourceMeta.empty(),
            null,
            NOW,
            NOW
        );
    }

    private static HttpFetchResult latinPage(String url) {
        byte[] body = """
            <html><head><title>Fournisseurs</title></head>
            <body><p>Société Générale Énergie is based in Lyon.</p></body></html>
            """.getBytes(StandardCharsets.ISO_8859_1);
        return new HttpFetchResult(
            url,
            URI.create(url),
            200,
            body,
            "text/html; charset=ISO-8859-1",
            NOW,
            Duration.ofMillis(12),
            null,
            null
        );
    }
}
