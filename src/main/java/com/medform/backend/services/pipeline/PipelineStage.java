package com.medform.backend.services.pipeline;

public enum PipelineStage {
    EXTRACTION("extraction"),
    MAPPING("mapping"),
    FILLING("filling"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    PipelineStage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
