package com.medform.backend.services.extraction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Lookup table of extraction strategies keyed by their method tag.
 */
@Component
@Slf4j
public class ExtractionStrategyRegistry {

    private final Map<ExtractionMethod, ExtractionStrategy> strategies;

    public ExtractionStrategyRegistry(List<ExtractionStrategy> strategies) {
        Map<ExtractionMethod, ExtractionStrategy> byMethod = new EnumMap<>(ExtractionMethod.class);
        if (strategies != null) {
            for (ExtractionStrategy strategy : strategies) {
                ExtractionMethod method = strategy.method();
                if (method != ExtractionMethod.VISION && method != ExtractionMethod.LEGACY_OCR) {
                    throw new IllegalStateException("Strategy " + strategy.getClass().getSimpleName()
                            + " declares non-strategy method " + method);
                }
                ExtractionStrategy previous = byMethod.putIfAbsent(method, strategy);
                if (previous != null) {
                    throw new IllegalStateException("Two extraction strategies registered for " + method.code());
                }
            }
        }
        this.strategies = Collections.unmodifiableMap(byMethod);
        log.info("[Extraction] Registered strategies: {}", this.strategies.keySet());
    }

    public Optional<ExtractionStrategy> find(ExtractionMethod method) {
        return Optional.ofNullable(strategies.get(method));
    }

    /**
     * Registered strategies in preference order (vision first).
     */
    public List<ExtractionStrategy> registered() {
        return List.copyOf(strategies.values());
    }

    public List<ExtractionMethod> availableMethods() {
        return strategies.values().stream()
                .filter(ExtractionStrategy::isAvailable)
                .map(ExtractionStrategy::method)
                .toList();
    }

    public boolean isEmpty() {
        return strategies.isEmpty();
    }
}
