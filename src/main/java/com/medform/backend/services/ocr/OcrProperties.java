package com.medform.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "medform.ocr")
public class OcrProperties {

    /**
     * Enables the Tesseract-backed legacy extractor.
     */
    private boolean enabled = false;

    /**
     * Tesseract language(s), e.g. "eng" or "eng+spa".
     */
    private String language = "eng";

    /**
     * Optional path that contains the "tessdata" directory.
     * If empty, Tess4J/Tesseract will rely on OS installation and environment.
     */
    private String tessdataPath = "";

    /**
     * Tesseract --oem. 3 lets Tesseract pick the best available engine.
     */
    private int engineMode = 3;

    /**
     * Tesseract --psm. 6 treats the page as a single uniform block of text.
     */
    private int pageSegMode = 6;

    /**
     * Render DPI for PDF pages before OCR.
     */
    private int renderDpi = 300;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    public int getEngineMode() {
        return engineMode;
    }

    public void setEngineMode(int engineMode) {
        this.engineMode = engineMode;
    }

    public int getPageSegMode() {
        return pageSegMode;
    }

    public void setPageSegMode(int pageSegMode) {
        this.pageSegMode = pageSegMode;
    }

    public int getRenderDpi() {
        return renderDpi;
    }

    public void setRenderDpi(int renderDpi) {
        this.renderDpi = renderDpi;
    }
}
