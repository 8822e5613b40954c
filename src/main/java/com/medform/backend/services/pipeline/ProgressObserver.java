package com.medform.backend.services.pipeline;

import java.util.Map;

/**
 * Receives stage transitions from the coordinator. Implementations must not assume they are
 * called from the thread that started the run.
 */
public interface ProgressObserver {

    ProgressObserver NONE = (stage, message, completed, details) -> { };

    void onProgress(ProgressStage stage, String message, boolean completed, Map<String, Object> details);

    default void onError(String error, PipelineStage failingStage) {
        onProgress(ProgressStage.FAILED, error, true, Map.of("failed_stage", failingStage.code()));
    }
}
