package com.medform.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.medform.backend.services.ocr.OcrProperties;
import com.medform.backend.services.ocr.OcrService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classical extractor: Tesseract on a grayscale page image, then fixed regex rules.
 * Free, and noticeably less accurate than the vision extractor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LegacyOcrExtractionStrategy implements ExtractionStrategy {

    static final double CONFIDENCE = 0.52;

    private final OcrService ocrService;
    private final OcrProperties ocrProperties;
    private final DocumentRasterizer documentRasterizer;
    private final Clock clock;

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.LEGACY_OCR;
    }

    @Override
    public boolean isAvailable() {
        return ocrProperties.isEnabled() && ocrService.isEnabled();
    }

    @Override
    public ExtractionResult extract(SourceDocument document) {
        if (!isAvailable()) {
            return ExtractionResult.failure(method(), "Legacy OCR extractor unavailable (medform.ocr.enabled=false)");
        }

        long start = System.currentTimeMillis();
        String text;
        try {
            BufferedImage page = documentRasterizer.rasterizeFirstPage(document, ocrProperties.getRenderDpi());
            BufferedImage gray = documentRasterizer.toGrayscale(page);
            try {
                text = ocrService.extractText(gray);
            } finally {
                page.flush();
                gray.flush();
            }
        } catch (Exception e) {
            log.error("[OCR] Legacy extraction failed: {}", e.toString());
            return ExtractionResult.failure(method(), "OCR failed: " + e.getMessage());
        }

        if (text == null || text.isBlank()) {
            log.warn("[OCR] No text recognized on page 1");
            return ExtractionResult.failure(method(), "OCR produced no text");
        }

        Map<String, Object> data = MnrTextParser.parse(text);
        long elapsed = System.currentTimeMillis() - start;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("method", method().code());
        metadata.put("processing_time_ms", elapsed);
        metadata.put("timestamp", Instant.now(clock).toString());
        metadata.put("ocr_text_length", text.length());
        data.put("_extraction_metadata", metadata);

        long matched = data.values().stream().filter(v -> v != null).count() - 1;
        log.info("[OCR] Legacy extraction ok (textLen={} matchedFields={} elapsedMs={})", text.length(), matched, elapsed);
        return ExtractionResult.success(data, method(), CONFIDENCE, 0d);
    }
}
