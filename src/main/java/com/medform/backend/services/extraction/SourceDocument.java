package com.medform.backend.services.extraction;

import java.util.Locale;

/**
 * Raw uploaded document. The MIME type is optional; when absent the bytes are sniffed.
 */
public record SourceDocument(byte[] bytes, String mimeType, String fileName) {

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};

    public SourceDocument {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Document is empty (0 bytes)");
        }
    }

    public static SourceDocument of(byte[] bytes, String fileName) {
        return new SourceDocument(bytes, null, fileName);
    }

    public boolean isPdf() {
        if (mimeType != null && !mimeType.isBlank()) {
            String mt = mimeType.trim().toLowerCase(Locale.ROOT);
            if (mt.equals("application/pdf")) return true;
            if (mt.startsWith("image/")) return false;
        }
        if (bytes.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (bytes[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }

    /**
     * File name without directory and extension, used to derive output names.
     */
    public String baseName() {
        String name = fileName == null || fileName.isBlank() ? "document" : fileName.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isBlank() ? "document" : name;
    }
}
