package com.medform.backend.services.forms.fill;

public enum FillMethod {
    STRUCTURED_FIELDS("structured_fields"),
    BASIC_FIELDS("basic_fields"),
    OVERLAY("overlay"),
    ALL_FAILED("all_failed");

    private final String code;

    FillMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
