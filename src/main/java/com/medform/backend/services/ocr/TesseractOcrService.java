package com.medform.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Reads a rasterized intake page with Tesseract. Engines hold native state and are not
 * thread-safe, so each pipeline worker thread gets its own configured engine.
 */
@Slf4j
public class TesseractOcrService implements OcrService {

    private static final String DEFAULT_LANGUAGE = "eng";

    private final OcrProperties ocrProperties;
    private final ThreadLocal<ITesseract> engines;

    public TesseractOcrService(OcrProperties ocrProperties) {
        this(ocrProperties, Tesseract::new);
    }

    TesseractOcrService(OcrProperties ocrProperties, Supplier<ITesseract> engineFactory) {
        this.ocrProperties = ocrProperties;
        this.engines = ThreadLocal.withInitial(() -> configure(engineFactory.get()));
    }

    @Override
    public String extractText(BufferedImage page) {
        if (page == null) return "";

        long start = System.currentTimeMillis();
        String text;
        try {
            text = engines.get().doOCR(page);
        } catch (TesseractException e) {
            throw new OcrException("Tesseract could not read the " + page.getWidth() + "x" + page.getHeight() + " page", e);
        } catch (UnsatisfiedLinkError e) {
            throw new OcrException("Tesseract native library is not installed on this host", e);
        }

        String result = text == null ? "" : text;
        log.info("[OCR] Page {}x{} read (chars={} elapsedMs={})",
                page.getWidth(), page.getHeight(), result.length(), System.currentTimeMillis() - start);
        return result;
    }

    ITesseract configure(ITesseract engine) {
        String tessdata = ocrProperties.getTessdataPath();
        if (tessdata != null && !tessdata.isBlank()) {
            engine.setDatapath(tessdata.trim());
        }
        String language = ocrProperties.getLanguage();
        engine.setLanguage(language == null || language.isBlank() ? DEFAULT_LANGUAGE : language.trim());
        engine.setOcrEngineMode(ocrProperties.getEngineMode());
        engine.setPageSegMode(ocrProperties.getPageSegMode());
        return engine;
    }
}
