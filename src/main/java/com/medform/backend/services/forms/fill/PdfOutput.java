package com.medform.backend.services.forms.fill;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;

final class PdfOutput {

    private PdfOutput() {
    }

    static PDDocument open(FillRequest request) {
        try {
            return PDDocument.load(request.template().bytes());
        } catch (IOException e) {
            throw new FillingException("Template is not a readable PDF: " + request.template().path(), e);
        }
    }

    static void save(PDDocument doc, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        doc.save(outputPath.toFile());
    }

    static boolean isTruthy(String value) {
        if (value == null) return false;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "true", "1", "on", "checked", "x" -> true;
            default -> false;
        };
    }
}
