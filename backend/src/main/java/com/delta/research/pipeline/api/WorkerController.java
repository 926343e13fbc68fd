package com.delta.research.pipeline.api;

import com.delta.research.pipeline.model.WorkerStatusResponse;
import com.delta.research.pipeline.service.ResearchWorkerDaemon;
import com.delta.research.pipeline.service.ResearchWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/worker")
public class WorkerController {
    private final ResearchWorkerService workerService;
    private final ResearchWorkerDaemon workerDaemon;

    public WorkerController(ResearchWorkerService workerService, ResearchWorkerDaemon workerDaemon) {
        this.workerService = workerService;
        this.workerDaemon = workerDaemon;
    }

    @PostMapping("/run-once")
    public Map<String, Object> runOnce() {
        ResearchWorkerService.WorkerResult result = workerService.runOnce();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("worker_id", workerService.getWorkerId());
        body.put("claimed", result != null);
        if (result != null) {
            body.put("job_id", result.jobId());
            body.put("run_id", result.runId());
            body.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
        }
        return body;
    }

    @PostMapping("/start")
    public WorkerStatusResponse start() {
        workerDaemon.start();
        return workerDaemon.getStatus();
    }

    @PostMapping("/stop")
    public WorkerStatusResponse stop() {
        workerDaemon.stop();
        return workerDaemon.getStatus();
    }

    @GetMapping("/status")
    public WorkerStatusResponse status() {
        return workerDaemon.getStatus();
    }
}
