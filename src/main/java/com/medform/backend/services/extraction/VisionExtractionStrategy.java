package com.medform.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medform.backend.services.ai.VisionModelClient;
import com.medform.backend.services.ai.VisionProperties;
import com.medform.backend.services.ai.VisionReply;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Vision language-model extractor: one request per document with the fixed MNR skeleton.
 * Only failed model calls are retried, up to {@code medform.vision.max-attempts}; a reply
 * that does not parse fails the extraction and still reports what it cost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisionExtractionStrategy implements ExtractionStrategy {

    static final double CONFIDENCE = 0.92;

    public static final String STATUS_DISABLED = "DISABLED";
    public static final String STATUS_NOT_CONFIGURED = "NOT_CONFIGURED";
    public static final String STATUS_READY = "READY";

    private final VisionProperties visionProperties;
    private final VisionModelClient visionModelClient;
    private final DocumentRasterizer documentRasterizer;
    private final Clock clock;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.VISION;
    }

    @Override
    public boolean isAvailable() {
        return STATUS_READY.equals(getStatus());
    }

    public String getStatus() {
        if (!visionProperties.isEnabled()) return STATUS_DISABLED;
        if (!visionProperties.hasApiKey()) return STATUS_NOT_CONFIGURED;
        return STATUS_READY;
    }

    @Override
    public ExtractionResult extract(SourceDocument document) {
        String status = getStatus();
        if (!STATUS_READY.equals(status)) {
            return ExtractionResult.failure(method(), "Vision extractor unavailable: " + status);
        }

        long start = System.currentTimeMillis();
        String dataUrl;
        try {
            BufferedImage page = documentRasterizer.rasterizeFirstPage(document, visionProperties.getRenderDpi());
            BufferedImage scaled = documentRasterizer.downscaleIfNeeded(page, visionProperties.getMaxImageBytes());
            byte[] png = documentRasterizer.toPng(scaled);
            dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(png);
            page.flush();
        } catch (Exception e) {
            log.warn("[Vision] Could not prepare page image: {}", e.toString());
            return ExtractionResult.failure(method(), "Could not read document: " + e.getMessage());
        }

        int maxAttempts = Math.max(1, visionProperties.getMaxAttempts());
        VisionReply reply = null;
        String lastError = "no attempt made";
        for (int attempt = 1; attempt <= maxAttempts && reply == null; attempt++) {
            try {
                reply = visionModelClient.complete(MnrExtractionPrompt.text(), dataUrl);
                if (reply == null) {
                    return ExtractionResult.failure(method(), "Vision extraction failed: model returned no reply");
                }
            } catch (Exception e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("[Vision] Model call error (attempt={}/{}): {}", attempt, maxAttempts, e.toString());
                if (attempt < maxAttempts) {
                    sleepBackoff(attempt);
                }
            }
        }
        if (reply == null) {
            return ExtractionResult.failure(method(), "Vision extraction failed: " + lastError);
        }

        long tokens = Math.max(0, reply.totalTokens());
        String model = reply.model() != null ? reply.model() : visionProperties.getModel();
        double cost = estimateCost(model, tokens);

        Map<String, Object> data;
        try {
            data = parseReply(reply.text());
        } catch (Exception e) {
            log.error("[Vision] Unusable model reply (tokens={}): {}", tokens, e.toString());
            return ExtractionResult.failure(method(), "Vision extraction failed: " + e.getMessage(), cost);
        }

        long elapsed = System.currentTimeMillis() - start;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("method", method().code());
        metadata.put("model", model);
        metadata.put("tokens_used", tokens);
        metadata.put("cost_estimate", cost);
        metadata.put("processing_time_ms", elapsed);
        metadata.put("timestamp", Instant.now(clock).toString());
        data.put("_extraction_metadata", metadata);

        log.info("[Vision] Extraction ok (tokens={} cost={} elapsedMs={} keys={})",
                tokens, String.format(Locale.ROOT, "%.4f", cost), elapsed, data.size());
        return ExtractionResult.success(data, method(), CONFIDENCE, cost);
    }

    /**
     * gpt-4o pricing splits tokens 80/20 between input ($0.005/1K) and output ($0.015/1K);
     * other models are priced flat at $0.002/1K.
     */
    static double estimateCost(String model, long totalTokens) {
        if (totalTokens <= 0) return 0d;
        String m = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (m.contains("gpt-4o")) {
            double input = totalTokens * 0.8d;
            double output = totalTokens * 0.2d;
            return (input / 1000d) * 0.005d + (output / 1000d) * 0.015d;
        }
        return (totalTokens / 1000d) * 0.002d;
    }

    private Map<String, Object> parseReply(String raw) throws Exception {
        String json = stripCodeFences(raw);
        if (json.isEmpty()) {
            throw new ExtractionException("Model returned an empty reply");
        }
        JsonNode node = objectMapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new ExtractionException("Model reply is not a JSON object");
        }
        return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }

    static String stripCodeFences(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("```")) {
            // Drop the opening ```json line and the closing fence
            int firstNewline = s.indexOf('\n');
            s = firstNewline >= 0 ? s.substring(firstNewline + 1) : s.substring(3);
            int lastFence = s.lastIndexOf("```");
            if (lastFence >= 0) {
                s = s.substring(0, lastFence);
            }
        }
        return s.trim();
    }

    private static void sleepBackoff(int attempt) {
        long ms = attempt == 1 ? 400 : 1200;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
