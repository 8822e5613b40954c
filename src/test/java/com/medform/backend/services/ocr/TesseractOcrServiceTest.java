package com.medform.backend.services.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;

class TesseractOcrServiceTest {

    private final BufferedImage page = new BufferedImage(40, 20, BufferedImage.TYPE_BYTE_GRAY);

    @Test
    void engine_configuredFromProperties() {
        OcrProperties properties = new OcrProperties();
        properties.setTessdataPath(" /opt/tessdata ");
        properties.setLanguage("eng+spa");
        ITesseract engine = mock(ITesseract.class);

        new TesseractOcrService(properties, () -> engine).configure(engine);

        verify(engine).setDatapath("/opt/tessdata");
        verify(engine).setLanguage("eng+spa");
        verify(engine).setOcrEngineMode(3);
        verify(engine).setPageSegMode(6);
    }

    @Test
    void blankSettings_fallBackToSystemTessdataAndEnglish() {
        OcrProperties properties = new OcrProperties();
        properties.setLanguage(" ");
        ITesseract engine = mock(ITesseract.class);

        new TesseractOcrService(properties, () -> engine).configure(engine);

        verify(engine, never()).setDatapath(anyString());
        verify(engine).setLanguage("eng");
    }

    @Test
    void extractText_reusesOneEnginePerThread() throws Exception {
        ITesseract engine = mock(ITesseract.class);
        when(engine.doOCR(any(BufferedImage.class))).thenReturn("Weight: 170", (String) null);
        AtomicInteger created = new AtomicInteger();
        TesseractOcrService service = new TesseractOcrService(new OcrProperties(), () -> {
            created.incrementAndGet();
            return engine;
        });

        assertEquals("Weight: 170", service.extractText(page));
        assertEquals("", service.extractText(page));
        assertEquals(1, created.get());
        verify(engine, times(2)).doOCR(page);
    }

    @Test
    void extractText_wrapsEngineFailure() throws Exception {
        ITesseract engine = mock(ITesseract.class);
        when(engine.doOCR(any(BufferedImage.class))).thenThrow(new TesseractException("bad image"));
        TesseractOcrService service = new TesseractOcrService(new OcrProperties(), () -> engine);

        OcrException error = assertThrows(OcrException.class, () -> service.extractText(page));

        assertTrue(error.getMessage().contains("40x20"));
        assertTrue(error.getCause() instanceof TesseractException);
    }

    @Test
    void extractText_nullPageSkipsEngine() {
        ITesseract engine = mock(ITesseract.class);
        TesseractOcrService service = new TesseractOcrService(new OcrProperties(), () -> engine);

        assertEquals("", service.extractText(null));
        verifyNoInteractions(engine);
    }
}
