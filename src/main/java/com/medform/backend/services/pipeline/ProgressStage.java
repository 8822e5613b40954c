package com.medform.backend.services.pipeline;

/**
 * Stages as reported to progress observers. Coarser-grained names than {@link PipelineStage}
 * because they are shown to people.
 */
public enum ProgressStage {
    UPLOAD("upload"),
    EXTRACTION("extraction"),
    PROCESSING("processing"),
    PDF_GENERATION("pdf_generation"),
    FINALIZATION("finalization"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    ProgressStage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
