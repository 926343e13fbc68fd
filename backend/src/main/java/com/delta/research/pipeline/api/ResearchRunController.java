package com.delta.research.pipeline.api;

import com.delta.research.pipeline.model.AttachSourceRequest;
import com.delta.research.pipeline.model.CreateRunRequest;
import com.delta.research.pipeline.model.RankedProspect;
import com.delta.research.pipeline.model.ResearchEvent;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchPlan;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.ranking.ProspectRankingService;
import com.delta.research.pipeline.ranking.RankingExporter;
import com.delta.research.pipeline.service.ResearchRunService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/runs")
public class ResearchRunController {
    static final String TENANT_HEADER = "X-Tenant-Id";

    private final ResearchRunService runService;
    private final ProspectRankingService rankingService;
    private final RankingExporter rankingExporter;

    public ResearchRunController(
        ResearchRunService runService,
        ProspectRankingService rankingService,
        RankingExporter rankingExporter
    ) {
        this.runService = runService;
        this.rankingService = rankingService;
        this.rankingExporter = rankingExporter;
    }

    @PostMapping
    public ResponseEntity<ResearchRun> createRun(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @RequestBody(required = false) CreateRunRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(runService.createRun(tenantId, request));
    }

    @GetMapping
    public List<ResearchRun> listRuns(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return runService.listRuns(tenantId, limit);
    }

    @GetMapping("/{runId}")
    public ResearchRun getRun(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.getRun(tenantId, runId);
    }

    @PostMapping("/{runId}/sources")
    public ResponseEntity<SourceDocument> attachSource(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable UUID runId,
        @RequestBody AttachSourceRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(runService.attachSource(tenantId, runId, request));
    }

    @GetMapping("/{runId}/sources")
    public List<SourceDocument> listSources(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.listSources(tenantId, runId);
    }

    @PostMapping("/{runId}/start")
    public ResponseEntity<ResearchJob> startRun(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(runService.startRun(tenantId, runId));
    }

    @PostMapping("/{runId}/cancel")
    public ResearchRun cancelRun(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.cancelRun(tenantId, runId);
    }

    @PostMapping("/{runId}/retry")
    public ResponseEntity<ResearchJob> retryRun(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(runService.retryRun(tenantId, runId));
    }

    @GetMapping("/{runId}/jobs")
    public List<ResearchJob> listJobs(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.listJobs(tenantId, runId);
    }

    @GetMapping("/{runId}/plan")
    public ResearchPlan getPlan(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.getPlan(tenantId, runId);
    }

    @GetMapping("/{runId}/steps")
    public List<ResearchStep> listSteps(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.listSteps(tenantId, runId);
    }

    @GetMapping("/{runId}/events")
    public List<ResearchEvent> listEvents(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return runService.listEvents(tenantId, runId);
    }

    @GetMapping("/{runId}/prospects-ranked")
    public List<RankedProspect> rankedProspects(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID runId) {
        return rankingService.rankRun(tenantId, runId);
    }

    @GetMapping(value = "/{runId}/prospects-ranked.json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> rankedProspectsJson(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable UUID runId
    ) {
        String body = rankingExporter.toJson(rankingService.rankRun(tenantId, runId));
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(runId, "json"))
            .body(body);
    }

    @GetMapping(value = "/{runId}/prospects-ranked.csv", produces = "text/csv")
    public ResponseEntity<String> rankedProspectsCsv(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable UUID runId
    ) {
        String body = rankingExporter.toCsv(rankingService.rankRun(tenantId, runId));
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType("text/csv"))
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(runId, "csv"))
            .body(body);
    }

    private static String attachment(UUID runId, String extension) {
        return "attachment; filename=\"prospects-ranked-" + runId + "." + extension + "\"";
    }
}
