package com.medform.backend.services.forms.fill;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of filling one template. {@code outputPath} is set only on success.
 */
public record FillingResult(
        boolean success,
        Path outputPath,
        int fieldsFilled,
        int totalFields,
        FillMethod methodUsed,
        List<String> warnings,
        String error
) {

    public FillingResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static FillingResult success(Path outputPath, int fieldsFilled, int totalFields, FillMethod method,
                                        List<String> warnings) {
        return new FillingResult(true, outputPath, fieldsFilled, totalFields, method, warnings, null);
    }

    public static FillingResult failure(FillMethod method, String error, List<String> warnings) {
        return new FillingResult(false, null, 0, 0, method, warnings, error);
    }

    public FillingResult withWarnings(List<String> allWarnings) {
        return new FillingResult(success, outputPath, fieldsFilled, totalFields, methodUsed, allWarnings, error);
    }
}
