package com.medform.backend.services.extraction;

import java.util.Map;

import com.medform.backend.services.util.TreeValues;

/**
 * Outcome of one extraction attempt. {@code data} is a read-only copy of the extracted tree.
 */
public record ExtractionResult(
        boolean success,
        Map<String, Object> data,
        ExtractionMethod methodUsed,
        double confidence,
        double cost,
        String error
) {

    public ExtractionResult {
        if (methodUsed == null) throw new IllegalArgumentException("methodUsed is required");
        if (confidence < 0d || confidence > 1d) throw new IllegalArgumentException("confidence must be within [0,1]");
        if (cost < 0d) throw new IllegalArgumentException("cost must be >= 0");
        data = TreeValues.immutableCopyMap(data);
    }

    public static ExtractionResult success(Map<String, Object> data, ExtractionMethod method, double confidence, double cost) {
        return new ExtractionResult(true, data, method, confidence, cost, null);
    }

    public static ExtractionResult failure(ExtractionMethod method, String error) {
        return failure(method, error, 0d);
    }

    /**
     * Failed attempt that still consumed paid model usage.
     */
    public static ExtractionResult failure(ExtractionMethod method, String error, double cost) {
        return new ExtractionResult(false, null, method, 0d, cost, error);
    }

    public ExtractionResult plusCost(double extra) {
        if (extra <= 0d) return this;
        return new ExtractionResult(success, data, methodUsed, confidence, cost + extra, error);
    }

    /**
     * Same data reported as a cache hit: nothing was spent this time.
     */
    public ExtractionResult asCached() {
        return new ExtractionResult(success, data, ExtractionMethod.CACHED, confidence, 0d, error);
    }
}
