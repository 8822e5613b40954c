package com.medform.backend.services.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.medform.backend.config.CacheProperties;
import com.medform.backend.services.extraction.ExtractionMethod;
import com.medform.backend.services.extraction.ExtractionResult;
import com.medform.backend.support.MutableClock;

class CacheStoreTest {

    private static final byte[] DOC = "%PDF-1.4 fake".getBytes(StandardCharsets.US_ASCII);

    private MutableClock clock;
    private CacheProperties properties;
    private CacheStore cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new CacheProperties();
        properties.setTtl(Duration.ofMinutes(30));
        cache = new CacheStore(clock, properties);
    }

    private static ExtractionResult ok() {
        return ExtractionResult.success(Map.of("Employer", "ACME"), ExtractionMethod.VISION, 0.95, 0.02);
    }

    @Test
    void entryExpiresAtTtl() {
        String key = cache.contentKey(DOC, "alice");
        cache.putExtraction(key, ExtractionMethod.AUTO, ok());

        clock.advance(Duration.ofMinutes(29));
        assertTrue(cache.getExtraction(key, ExtractionMethod.AUTO).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.getExtraction(key, ExtractionMethod.AUTO).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void entriesAreKeyedByMethod() {
        String key = cache.contentKey(DOC, "alice");
        cache.putExtraction(key, ExtractionMethod.VISION, ok());

        assertTrue(cache.getExtraction(key, ExtractionMethod.LEGACY_OCR).isEmpty());
        assertEquals("ACME", cache.getExtraction(key, ExtractionMethod.VISION).orElseThrow().data().get("Employer"));
    }

    @Test
    void failuresAreNotCached() {
        String key = cache.contentKey(DOC, null);
        cache.putExtraction(key, ExtractionMethod.AUTO, ExtractionResult.failure(ExtractionMethod.ALL_FAILED, "boom"));

        assertEquals(0, cache.size());
    }

    @Test
    void requesterScope_partitionsByCaller() {
        assertNotEquals(cache.contentKey(DOC, "alice"), cache.contentKey(DOC, "bob"));
        assertEquals(cache.contentKey(DOC, null), cache.contentKey(DOC, "anonymous"));
    }

    @Test
    void contentScope_sharesAcrossCallers() {
        properties.setScope(CacheProperties.Scope.CONTENT);

        assertEquals(cache.contentKey(DOC, "alice"), cache.contentKey(DOC, "bob"));
        assertEquals(CacheStore.sha256Hex(DOC), cache.contentKey(DOC, "alice"));
    }

    @Test
    void writeSweepsExpiredEntries() {
        cache.putExtraction("a", ExtractionMethod.AUTO, ok());
        clock.advance(Duration.ofHours(1));
        cache.putExtraction("b", ExtractionMethod.AUTO, ok());

        assertEquals(1, cache.size());
    }

    @Test
    void templateBytesLoadedOnce() {
        AtomicInteger loads = new AtomicInteger();

        cache.template("/t/a.pdf", p -> { loads.incrementAndGet(); return new byte[]{1}; });
        cache.template("/t/a.pdf", p -> { loads.incrementAndGet(); return new byte[]{2}; });

        assertEquals(1, loads.get());
        assertEquals(1, cache.templateCount());
        cache.clear();
        assertEquals(0, cache.templateCount());
    }

    @Test
    void sha256Hex_knownVector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                CacheStore.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }
}
