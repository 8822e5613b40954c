package com.medform.backend.services.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.springframework.stereotype.Component;

import com.medform.backend.config.CacheProperties;
import com.medform.backend.services.extraction.ExtractionMethod;
import com.medform.backend.services.extraction.ExtractionResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process caches: extraction results with a TTL, and template bytes keyed by path.
 * Expired extraction entries are dropped lazily on read and swept on every write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheStore {

    private final Clock clock;
    private final CacheProperties properties;

    private final Map<String, Entry> extractions = new ConcurrentHashMap<>();
    private final Map<String, byte[]> templates = new ConcurrentHashMap<>();

    private record Entry(ExtractionResult result, Instant expiresAt) {
    }

    /**
     * Cache key for a document, partitioned by requester when the scope asks for it.
     */
    public String contentKey(byte[] bytes, String requesterId) {
        String hash = sha256Hex(bytes);
        if (properties.getScope() == CacheProperties.Scope.REQUESTER) {
            String who = requesterId == null || requesterId.isBlank() ? "anonymous" : requesterId.trim();
            return sha256Hex((who + ":" + hash).getBytes(StandardCharsets.UTF_8));
        }
        return hash;
    }

    public Optional<ExtractionResult> getExtraction(String contentKey, ExtractionMethod method) {
        String key = extractionKey(contentKey, method);
        Entry entry = extractions.get(key);
        if (entry == null) return Optional.empty();
        if (!clock.instant().isBefore(entry.expiresAt())) {
            extractions.remove(key, entry);
            log.debug("[Cache] expired key={}", key);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    public void putExtraction(String contentKey, ExtractionMethod method, ExtractionResult result) {
        if (result == null || !result.success()) return;
        Instant now = clock.instant();
        extractions.values().removeIf(e -> !now.isBefore(e.expiresAt()));
        Duration ttl = properties.getTtl() == null ? Duration.ofMinutes(30) : properties.getTtl();
        extractions.put(extractionKey(contentKey, method), new Entry(result, now.plus(ttl)));
    }

    public byte[] template(String path, Function<String, byte[]> loader) {
        return templates.computeIfAbsent(path, loader);
    }

    public void clear() {
        extractions.clear();
        templates.clear();
        log.info("[Cache] cleared");
    }

    public int size() {
        return extractions.size();
    }

    public int templateCount() {
        return templates.size();
    }

    static String extractionKey(String contentKey, ExtractionMethod method) {
        return contentKey + "_" + method.code();
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(bytes == null ? new byte[0] : bytes);
            return toHexLower(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to compute SHA-256", e);
        }
    }

    private static String toHexLower(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        final char[] alphabet = "0123456789abcdef".toCharArray();
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = alphabet[v >>> 4];
            hex[i * 2 + 1] = alphabet[v & 0x0F];
        }
        return new String(hex);
    }
}
