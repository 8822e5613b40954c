package com.medform.backend.services.extraction;

import java.util.Locale;

/**
 * Closed set of extraction tags. {@link #AUTO}, {@link #VISION} and {@link #LEGACY_OCR} may be
 * requested; the remaining values only ever appear as {@code methodUsed} on a result.
 */
public enum ExtractionMethod {
    AUTO("auto"),
    VISION("vision"),
    LEGACY_OCR("legacy_ocr"),
    CACHED("cached"),
    SAMPLE("sample"),
    ALL_FAILED("all_failed");

    private final String code;

    ExtractionMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isRequestable() {
        return this == AUTO || this == VISION || this == LEGACY_OCR;
    }

    public static ExtractionMethod fromCode(String raw) {
        if (raw == null || raw.isBlank()) return AUTO;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        // Older callers used "openai" for the vision extractor and "legacy" for OCR.
        if (v.equals("openai")) return VISION;
        if (v.equals("legacy") || v.equals("ocr")) return LEGACY_OCR;
        for (ExtractionMethod m : values()) {
            if (m.code.equals(v)) {
                if (!m.isRequestable()) break;
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown extraction method: " + raw);
    }
}
