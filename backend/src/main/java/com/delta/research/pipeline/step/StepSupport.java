package com.delta.research.pipeline.step;

import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

final class StepSupport {
    private StepSupport() {
    }

    static boolean hasDocuments(SourceDocumentRepository sources, StepContext context) {
        for (SourceType type : SourceType.values()) {
            if (type.isDocument() && sources.hasSources(context.tenantId(), context.runId(), type)) {
                return true;
            }
        }
        return false;
    }

    static int secondsUntil(Instant target) {
        if (target == null) {
            return 1;
        }
        long millis = Duration.between(Instant.now(), target).toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    static Map<String, Object> output(String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(key, value);
        return out;
    }
}
