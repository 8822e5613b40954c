package com.medform.backend.services.extraction;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted strategy that counts its calls.
 */
class FakeStrategy implements ExtractionStrategy {

    private final ExtractionMethod method;
    private final boolean available;
    private final ExtractionResult result;
    final AtomicInteger calls = new AtomicInteger();

    FakeStrategy(ExtractionMethod method, boolean available, ExtractionResult result) {
        this.method = method;
        this.available = available;
        this.result = result;
    }

    static FakeStrategy succeeding(ExtractionMethod method, Map<String, Object> data) {
        return new FakeStrategy(method, true, ExtractionResult.success(data, method, 0.9, 0.01));
    }

    static FakeStrategy failing(ExtractionMethod method, String error) {
        return new FakeStrategy(method, true, ExtractionResult.failure(method, error));
    }

    @Override
    public ExtractionMethod method() {
        return method;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public ExtractionResult extract(SourceDocument document) {
        calls.incrementAndGet();
        return result;
    }
}
