package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.StepKey;

/**
 * One plan step. Runs inside the step's transaction; a thrown exception rolls the step back and
 * counts as a failed attempt.
 */
public interface StepHandler {
    StepKey key();

    StepOutcome execute(StepContext context);
}
