package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.StepKey;
import com.delta.research.pipeline.service.TerminalRunFailureException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a stored step key to its handler. Every {@link StepKey} must have exactly one handler.
 */
@Component
public class StepDispatcher {
    private final Map<StepKey, StepHandler> handlers = new EnumMap<>(StepKey.class);

    public StepDispatcher(List<StepHandler> handlers) {
        for (StepHandler handler : handlers) {
            StepHandler previous = this.handlers.put(handler.key(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for step " + handler.key().key());
            }
        }
        for (StepKey key : StepKey.values()) {
            if (!this.handlers.containsKey(key)) {
                throw new IllegalStateException("No handler registered for step " + key.key());
            }
        }
    }

    public StepOutcome dispatch(String stepKey, StepContext context) {
        StepKey key = StepKey.fromKey(stepKey);
        if (key == null) {
            throw new TerminalRunFailureException("unknown_step_key", "unknown_step_key: " + stepKey);
        }
        return handlers.get(key).execute(context);
    }
}
