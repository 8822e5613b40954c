package com.medform.backend.services.fallback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Ordered list of alternative handlers. The first handler whose result passes the
 * success predicate wins; every earlier failure (unsuccessful result or thrown
 * exception) is collected in order.
 *
 * <p>Shared by the extraction fallback and the PDF fill cascade.
 */
@Slf4j
public final class FallbackChain<T> {

    private final String name;
    private final List<Candidate<T>> candidates;
    private final Predicate<T> isSuccess;
    private final Function<T, String> failureReason;

    private FallbackChain(String name, List<Candidate<T>> candidates, Predicate<T> isSuccess,
                          Function<T, String> failureReason) {
        this.name = name;
        this.candidates = List.copyOf(candidates);
        this.isSuccess = isSuccess;
        this.failureReason = failureReason;
    }

    public static <T> Builder<T> builder(String name, Predicate<T> isSuccess) {
        return new Builder<>(name, isSuccess);
    }

    public Outcome<T> run() {
        List<String> failures = new ArrayList<>();
        List<String> attempted = new ArrayList<>();
        T last = null;

        for (Candidate<T> candidate : candidates) {
            attempted.add(candidate.label());
            try {
                T result = candidate.attempt().get();
                if (result != null && isSuccess.test(result)) {
                    log.info("[{}] '{}' succeeded (attempt {}/{})", name, candidate.label(), attempted.size(), candidates.size());
                    return new Outcome<>(result, candidate.label(), attempted, failures);
                }
                String reason = result == null ? "no result" : safe(failureReason.apply(result));
                log.warn("[{}] '{}' failed: {}", name, candidate.label(), reason);
                failures.add(candidate.label() + ": " + reason);
                if (result != null) last = result;
            } catch (RuntimeException e) {
                log.warn("[{}] '{}' threw: {}", name, candidate.label(), e.toString());
                failures.add(candidate.label() + ": " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }

        return new Outcome<>(last, null, attempted, failures);
    }

    public int size() {
        return candidates.size();
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? "unsuccessful" : value;
    }

    public record Candidate<T>(String label, Supplier<T> attempt) {
        public Candidate {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(attempt, "attempt");
        }
    }

    /**
     * @param result the winning result, or the last unsuccessful one when nothing won (may be null)
     * @param winner label of the winning candidate, null when every candidate failed
     */
    public record Outcome<T>(T result, String winner, List<String> attempted, List<String> failures) {
        public Outcome {
            attempted = Collections.unmodifiableList(attempted);
            failures = Collections.unmodifiableList(failures);
        }

        public boolean succeeded() {
            return winner != null;
        }
    }

    public static final class Builder<T> {
        private final String name;
        private final Predicate<T> isSuccess;
        private final List<Candidate<T>> candidates = new ArrayList<>();
        private Function<T, String> failureReason = r -> null;

        private Builder(String name, Predicate<T> isSuccess) {
            this.name = name;
            this.isSuccess = Objects.requireNonNull(isSuccess, "isSuccess");
        }

        public Builder<T> attempt(String label, Supplier<T> attempt) {
            candidates.add(new Candidate<>(label, attempt));
            return this;
        }

        public Builder<T> failureReason(Function<T, String> failureReason) {
            this.failureReason = Objects.requireNonNull(failureReason, "failureReason");
            return this;
        }

        public FallbackChain<T> build() {
            return new FallbackChain<>(name, candidates, isSuccess, failureReason);
        }
    }
}
