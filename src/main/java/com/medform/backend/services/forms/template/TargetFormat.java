package com.medform.backend.services.forms.template;

import java.util.Locale;

/**
 * A fillable output form. {@code code} is the config and file-name token.
 */
public enum TargetFormat {
    SOURCE_SCHEMA("source_schema", "mnr"),
    TARGET_SCHEMA("target_schema", "ash");

    private final String code;
    private final String fileToken;

    TargetFormat(String code, String fileToken) {
        this.code = code;
        this.fileToken = fileToken;
    }

    public String code() {
        return code;
    }

    public String fileToken() {
        return fileToken;
    }

    public FieldMappingTable table() {
        return this == SOURCE_SCHEMA ? MnrFieldMappings.table() : AshFieldMappings.table();
    }

    public static TargetFormat fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (TargetFormat f : values()) {
            if (f.code.equals(c) || f.fileToken.equals(c)) return f;
        }
        throw new IllegalArgumentException("Unknown target format: " + code);
    }
}
