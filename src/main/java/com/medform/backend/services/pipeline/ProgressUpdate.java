package com.medform.backend.services.pipeline;

import java.time.Instant;
import java.util.Map;

public record ProgressUpdate(
        String sessionId,
        ProgressStage stage,
        String message,
        boolean completed,
        Map<String, Object> details,
        Instant timestamp
) {

    public ProgressUpdate {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
