package com.medform.backend.services.extraction;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.medform.backend.services.fallback.FallbackChain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks an extraction strategy for the requested method and falls back to the other
 * registered strategy once when the first one fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionOrchestrator {

    private final ExtractionStrategyRegistry registry;

    /**
     * @throws ExtractionException when no strategy is registered or none is available at all
     */
    public ExtractionResult extract(SourceDocument document, ExtractionMethod requested, boolean fallbackEnabled) {
        if (document == null) {
            throw new IllegalArgumentException("document is required");
        }
        ExtractionMethod method = requested == null ? ExtractionMethod.AUTO : requested;
        if (!method.isRequestable()) {
            throw new IllegalArgumentException("Extraction method cannot be requested: " + method.code());
        }
        if (registry.isEmpty()) {
            throw new ExtractionException("No extraction strategies are registered");
        }
        if (registry.availableMethods().isEmpty()) {
            throw new ExtractionException("No extraction strategy is configured (vision needs an API key, legacy OCR needs medform.ocr.enabled=true)");
        }

        List<ExtractionStrategy> order = attemptOrder(method, fallbackEnabled);
        if (order.isEmpty()) {
            return ExtractionResult.failure(ExtractionMethod.ALL_FAILED,
                    "Requested extraction method is not registered: " + method.code());
        }

        List<ExtractionResult> failed = new ArrayList<>();
        FallbackChain.Builder<ExtractionResult> chain = FallbackChain
                .<ExtractionResult>builder("Extraction", ExtractionResult::success)
                .failureReason(r -> {
                    failed.add(r);
                    return r.error();
                });
        for (ExtractionStrategy strategy : order) {
            chain.attempt(strategy.method().code(), () -> strategy.extract(document));
        }

        log.info("[Extraction] Starting: requested={} order={} fallback={}",
                method.code(), order.stream().map(s -> s.method().code()).toList(), fallbackEnabled);
        FallbackChain.Outcome<ExtractionResult> outcome = chain.build().run();
        double spentOnFailures = failed.stream().mapToDouble(ExtractionResult::cost).sum();
        if (outcome.succeeded()) {
            return outcome.result().plusCost(spentOnFailures);
        }

        String error = "All extraction methods failed: " + String.join("; ", outcome.failures());
        log.error("[Extraction] {}", error);
        return ExtractionResult.failure(ExtractionMethod.ALL_FAILED, error, spentOnFailures);
    }

    public List<ExtractionMethod> availableMethods() {
        return registry.availableMethods();
    }

    private List<ExtractionStrategy> attemptOrder(ExtractionMethod method, boolean fallbackEnabled) {
        ExtractionStrategy primary;
        if (method == ExtractionMethod.AUTO) {
            primary = registry.registered().stream()
                    .filter(ExtractionStrategy::isAvailable)
                    .findFirst()
                    .orElse(null);
        } else {
            primary = registry.find(method).orElse(null);
        }

        List<ExtractionStrategy> order = new ArrayList<>();
        if (primary != null) {
            order.add(primary);
        }
        if (fallbackEnabled) {
            for (ExtractionStrategy candidate : registry.registered()) {
                if (candidate != primary) {
                    order.add(candidate);
                }
            }
        }
        return order;
    }
}
