package com.delta.research.pipeline.model;

public record WorkerStatusResponse(
    String workerId,
    boolean daemonRunning,
    int activeWorkers,
    long queuedJobs,
    long runningJobs
) {
}
