package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.service.RunCancelledException;

import java.util.UUID;
import java.util.function.BooleanSupplier;

public final class StepContext {
    private final ResearchRun run;
    private final ResearchStep step;
    private final ResearchJob job;
    private final BooleanSupplier cancelCheck;

    public StepContext(ResearchRun run, ResearchStep step, ResearchJob job, BooleanSupplier cancelCheck) {
        this.run = run;
        this.step = step;
        this.job = job;
        this.cancelCheck = cancelCheck == null ? () -> false : cancelCheck;
    }

    public String tenantId() {
        return run.tenantId();
    }

    public UUID runId() {
        return run.id();
    }

    public RunConfig config() {
        return run.config() == null ? RunConfig.empty() : run.config();
    }

    public ResearchRun run() {
        return run;
    }

    public ResearchStep step() {
        return step;
    }

    public ResearchJob job() {
        return job;
    }

    /**
     * Mid-step cancellation point, called between documents.
     */
    public void checkpoint() {
        if (cancelCheck.getAsBoolean()) {
            throw new RunCancelledException(run.id());
        }
    }
}
