package com.medform.backend.services.ocr;

import java.nio.file.Files;
import java.nio.file.Path;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the engine behind the legacy_ocr extraction method. Tesseract is only created when
 * {@code medform.ocr.enabled=true}; otherwise the method reports itself unavailable.
 */
@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "medform.ocr", name = "enabled", havingValue = "true")
    public OcrService tesseractOcrService(OcrProperties ocrProperties) {
        String tessdata = ocrProperties.getTessdataPath();
        boolean systemTessdata = tessdata == null || tessdata.isBlank();
        if (!systemTessdata && !Files.isDirectory(Path.of(tessdata.trim()))) {
            log.warn("[OCR] tessdata directory '{}' not found; legacy_ocr extractions will fail", tessdata);
        }
        log.info("[OCR] legacy_ocr on: lang={} oem={} psm={} dpi={} tessdata={}",
                ocrProperties.getLanguage(), ocrProperties.getEngineMode(), ocrProperties.getPageSegMode(),
                ocrProperties.getRenderDpi(), systemTessdata ? "<system>" : tessdata);
        return new TesseractOcrService(ocrProperties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrService.class)
    public OcrService disabledOcrService() {
        log.info("[OCR] legacy_ocr off (medform.ocr.enabled=false)");
        return new DisabledOcrService();
    }
}
