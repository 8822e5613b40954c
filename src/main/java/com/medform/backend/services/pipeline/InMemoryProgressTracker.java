package com.medform.backend.services.pipeline;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the progress history of each processing session in memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryProgressTracker {

    private final Clock clock;

    private final Map<String, List<ProgressUpdate>> sessions = new ConcurrentHashMap<>();

    /**
     * Observer that records every event under {@code sessionId}.
     */
    public ProgressObserver observer(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return (stage, message, completed, details) -> record(sessionId, stage, message, completed, details);
    }

    public ProgressUpdate record(String sessionId, ProgressStage stage, String message, boolean completed,
                                 Map<String, Object> details) {
        ProgressUpdate update = new ProgressUpdate(sessionId, stage, message, completed, details, clock.instant());
        sessions.computeIfAbsent(sessionId, id -> new CopyOnWriteArrayList<>()).add(update);
        log.debug("[Progress] session={} stage={} completed={}", sessionId, stage.code(), completed);
        return update;
    }

    public Optional<ProgressUpdate> latest(String sessionId) {
        List<ProgressUpdate> history = sessions.get(sessionId);
        if (history == null || history.isEmpty()) return Optional.empty();
        return Optional.of(history.get(history.size() - 1));
    }

    public List<ProgressUpdate> history(String sessionId) {
        List<ProgressUpdate> history = sessions.get(sessionId);
        return history == null ? List.of() : List.copyOf(history);
    }

    public boolean isFinished(String sessionId) {
        return latest(sessionId).map(u -> u.stage().isTerminal()).orElse(false);
    }

    public void clear(String sessionId) {
        sessions.remove(sessionId);
    }

    public Set<String> sessions() {
        return Set.copyOf(sessions.keySet());
    }
}
