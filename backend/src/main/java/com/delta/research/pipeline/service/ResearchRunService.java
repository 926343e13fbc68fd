package com.delta.research.pipeline.service;

import com.delta.research.config.ResearchProperties;
import com.delta.research.pipeline.model.AttachSourceRequest;
import com.delta.research.pipeline.model.CreateRunRequest;
import com.delta.research.pipeline.model.ResearchEvent;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchPlan;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.model.RunStatus;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.ResearchEventRepository;
import com.delta.research.pipeline.persistence.ResearchJobRepository;
import com.delta.research.pipeline.persistence.ResearchPlanRepository;
import com.delta.research.pipeline.persistence.ResearchRunRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Run lifecycle as seen by API callers: create, attach sources, start, cancel, retry, and reads.
 */
@Service
public class ResearchRunService {
    private static final Logger log = LoggerFactory.getLogger(ResearchRunService.class);
    private static final int DEFAULT_LIST_LIMIT = 50;

    private final ResearchRunRepository runRepository;
    private final ResearchJobRepository jobRepository;
    private final ResearchPlanRepository planRepository;
    private final ResearchEventRepository eventRepository;
    private final SourceDocumentRepository sourceRepository;
    private final PlanService planService;
    private final ResearchProperties properties;

    public ResearchRunService(
        ResearchRunRepository runRepository,
        ResearchJobRepository jobRepository,
        ResearchPlanRepository planRepository,
        ResearchEventRepository eventRepository,
        SourceDocumentRepository sourceRepository,
        PlanService planService,
        ResearchProperties properties
    ) {
        this.runRepository = runRepository;
        this.jobRepository = jobRepository;
        this.planRepository = planRepository;
        this.eventRepository = eventRepository;
        this.sourceRepository = sourceRepository;
        this.planService = planService;
        this.properties = properties;
    }

    @Transactional
    public ResearchRun createRun(String tenantId, CreateRunRequest request) {
        String name = request == null || request.name() == null || request.name().isBlank()
            ? "research run"
            : request.name().trim();
        RunConfig config = RunConfig.of(request == null ? null : request.targetCountries());
        ResearchRun run = runRepository.insertRun(tenantId, name, config);
        planService.ensurePlanAndSteps(run);
        eventRepository.append(tenantId, run.id(), "run_created", "ok", Map.of("name", name), null, null);
        log.info("Created research run {} for tenant {}", run.id(), tenantId);
        return run;
    }

    /**
     * @throws PlanLockedException once the run has been started
     */
    @Transactional
    public SourceDocument attachSource(String tenantId, UUID runId, AttachSourceRequest request) {
        ResearchRun run = requireRun(tenantId, runId);
        if (planService.isPlanLocked(tenantId, runId)) {
            throw new PlanLockedException(runId);
        }
        if (request == null || request.sourceType() == null) {
            throw new IllegalArgumentException("source_type is required");
        }
        SourceType type = SourceType.fromValue(request.sourceType());
        int maxAttempts = properties.getSources().getMaxAttempts();
        String title = blankToNull(request.title());
        SourceDocument source = switch (type) {
            case URL -> {
                String url = blankToNull(request.url());
                if (url == null) {
                    throw new IllegalArgumentException("url is required for url sources");
                }
                yield sourceRepository.insertSource(
                    tenantId, run.id(), type, SourceStatus.QUEUED, title, url, null, null, null, null, maxAttempts
                );
            }
            case PDF -> {
                if (blankToNull(request.contentBase64()) == null) {
                    throw new IllegalArgumentException("content_base64 is required for pdf sources");
                }
                byte[] bytes = Base64.getMimeDecoder().decode(request.contentBase64());
                yield sourceRepository.insertSource(
                    tenantId, run.id(), type, SourceStatus.NEW, title, null, null, null, bytes, "application/pdf", maxAttempts
                );
            }
            case TEXT, LIST, PROPOSAL -> {
                if (request.content() == null || request.content().isBlank()) {
                    throw new IllegalArgumentException("content is required for " + type.value() + " sources");
                }
                yield sourceRepository.insertSource(
                    tenantId, run.id(), type, SourceStatus.NEW, title, null, null, request.content(), null, null, maxAttempts
                );
            }
        };
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("source_id", source.id().toString());
        output.put("source_type", type.value());
        eventRepository.append(tenantId, run.id(), "source_attached", "ok", null, output, null);
        return source;
    }

    /**
     * Locks the plan and enqueues the run's job. Starting an already started run returns its active job.
     */
    @Transactional
    public ResearchJob startRun(String tenantId, UUID runId) {
        ResearchRun run = requireRun(tenantId, runId);
        if (run.status().isTerminal() || run.status() == RunStatus.CANCEL_REQUESTED) {
            throw new InvalidRunStateException("Run " + runId + " cannot be started from status " + run.status().value());
        }
        boolean locked = planService.lockPlanOnStart(run);
        ResearchJob job = jobRepository.enqueue(
            tenantId,
            runId,
            properties.getJobs().getJobType(),
            properties.getJobs().getMaxAttempts()
        );
        eventRepository.append(
            tenantId,
            runId,
            "run_started",
            "ok",
            null,
            Map.of("job_id", job.id().toString(), "plan_locked_now", locked),
            null
        );
        return job;
    }

    /**
     * Requests cancellation. A run whose job nobody has claimed is cancelled right away; a running
     * job observes the request at its next checkpoint.
     */
    @Transactional
    public ResearchRun cancelRun(String tenantId, UUID runId) {
        ResearchRun run = requireRun(tenantId, runId);
        if (run.status() == RunStatus.CANCELLED || run.status() == RunStatus.CANCEL_REQUESTED) {
            return run;
        }
        if (run.status().isTerminal()) {
            throw new InvalidRunStateException("Run " + runId + " already finished with status " + run.status().value());
        }
        runRepository.requestCancel(tenantId, runId);
        jobRepository.requestCancel(tenantId, runId);
        ResearchJob active = jobRepository.findActiveJob(tenantId, runId, properties.getJobs().getJobType());
        boolean immediate = active == null || jobRepository.cancelQueuedJob(active.id());
        if (immediate) {
            planRepository.cancelOpenSteps(tenantId, runId);
            runRepository.markCancelled(tenantId, runId);
            eventRepository.append(tenantId, runId, "run_cancelled", "cancelled", null, Map.of("immediate", true), null);
        } else {
            eventRepository.append(tenantId, runId, "cancel_requested", "ok", null, Map.of("job_id", active.id().toString()), null);
        }
        log.info("Cancellation requested for run {} (immediate={})", runId, immediate);
        return runRepository.findRun(tenantId, runId);
    }

    /**
     * Resumes a failed run from its failed steps. Succeeded and skipped steps keep their results.
     */
    @Transactional
    public ResearchJob retryRun(String tenantId, UUID runId) {
        ResearchRun run = requireRun(tenantId, runId);
        if (run.status() != RunStatus.FAILED) {
            throw new InvalidRunStateException("Only failed runs can be retried; run " + runId + " is " + run.status().value());
        }
        int resetSteps = planRepository.resetStepsForRetry(tenantId, runId);
        runRepository.resetForRetry(tenantId, runId);
        ResearchJob job = jobRepository.enqueue(
            tenantId,
            runId,
            properties.getJobs().getJobType(),
            properties.getJobs().getMaxAttempts()
        );
        eventRepository.append(
            tenantId,
            runId,
            "run_retry",
            "ok",
            null,
            Map.of("job_id", job.id().toString(), "steps_reset", resetSteps),
            null
        );
        return job;
    }

    public ResearchRun getRun(String tenantId, UUID runId) {
        return requireRun(tenantId, runId);
    }

    public List<ResearchRun> listRuns(String tenantId, Integer limit) {
        return runRepository.listRuns(tenantId, limit == null ? DEFAULT_LIST_LIMIT : limit);
    }

    public ResearchPlan getPlan(String tenantId, UUID runId) {
        requireRun(tenantId, runId);
        ResearchPlan plan = planRepository.findPlan(tenantId, runId);
        if (plan == null) {
            throw new ResourceNotFoundException("No plan for run " + runId);
        }
        return plan;
    }

    public List<ResearchStep> listSteps(String tenantId, UUID runId) {
        requireRun(tenantId, runId);
        return planRepository.listSteps(tenantId, runId);
    }

    public List<ResearchEvent> listEvents(String tenantId, UUID runId) {
        requireRun(tenantId, runId);
        return eventRepository.listEvents(tenantId, runId);
    }

    public List<SourceDocument> listSources(String tenantId, UUID runId) {
        requireRun(tenantId, runId);
        return sourceRepository.listSources(tenantId, runId);
    }

    public List<ResearchJob> listJobs(String tenantId, UUID runId) {
        requireRun(tenantId, runId);
        return jobRepository.listJobs(tenantId, runId);
    }

    private ResearchRun requireRun(String tenantId, UUID runId) {
        ResearchRun run = runRepository.findRun(tenantId, runId);
        if (run == null) {
            throw new ResourceNotFoundException("Run " + runId + " not found");
        }
        return run;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
