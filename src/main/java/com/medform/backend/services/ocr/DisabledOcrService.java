package com.medform.backend.services.ocr;

import java.awt.image.BufferedImage;

public class DisabledOcrService implements OcrService {

    @Override
    public String extractText(BufferedImage image) {
        throw new IllegalStateException("OCR is disabled. Enable it with medform.ocr.enabled=true");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
