package com.medform.backend.services.forms.template;

import java.util.List;
import java.util.Locale;

public enum OutputFormat {
    SOURCE_SCHEMA("source_schema", List.of(TargetFormat.SOURCE_SCHEMA)),
    TARGET_SCHEMA("target_schema", List.of(TargetFormat.TARGET_SCHEMA)),
    BOTH("both", List.of(TargetFormat.TARGET_SCHEMA, TargetFormat.SOURCE_SCHEMA));

    private final String code;
    private final List<TargetFormat> formats;

    OutputFormat(String code, List<TargetFormat> formats) {
        this.code = code;
        this.formats = formats;
    }

    public String code() {
        return code;
    }

    public List<TargetFormat> formats() {
        return formats;
    }

    public boolean isDual() {
        return formats.size() > 1;
    }

    public static OutputFormat fromCode(String code) {
        if (code == null || code.isBlank()) return TARGET_SCHEMA;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.code.equals(c)) return f;
        }
        throw new IllegalArgumentException("Unknown output format: " + code);
    }
}
