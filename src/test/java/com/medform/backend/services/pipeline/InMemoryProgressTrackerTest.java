package com.medform.backend.services.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.medform.backend.support.MutableClock;

class InMemoryProgressTrackerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T12:00:00Z"));
    private final InMemoryProgressTracker tracker = new InMemoryProgressTracker(clock);

    @Test
    void observer_recordsHistoryPerSession() {
        ProgressObserver a = tracker.observer("a");
        ProgressObserver b = tracker.observer("b");

        a.onProgress(ProgressStage.EXTRACTION, "Extracting", false, Map.of("method", "auto"));
        clock.advance(Duration.ofSeconds(3));
        a.onProgress(ProgressStage.EXTRACTION, "Done", true, null);
        b.onProgress(ProgressStage.UPLOAD, "Received", true, Map.of());

        assertEquals(2, tracker.history("a").size());
        assertEquals("Done", tracker.latest("a").orElseThrow().message());
        assertEquals(Instant.parse("2026-02-01T12:00:03Z"), tracker.latest("a").orElseThrow().timestamp());
        assertTrue(tracker.latest("a").orElseThrow().details().isEmpty());
        assertEquals(2, tracker.sessions().size());
        assertFalse(tracker.isFinished("a"));
    }

    @Test
    void onError_isTerminal() {
        ProgressObserver observer = tracker.observer("a");

        observer.onError("boom", PipelineStage.FILLING);

        assertTrue(tracker.isFinished("a"));
        assertEquals("filling", tracker.latest("a").orElseThrow().details().get("failed_stage"));
    }

    @Test
    void clear_dropsSession() {
        tracker.observer("a").onProgress(ProgressStage.COMPLETED, "ok", true, Map.of());

        tracker.clear("a");

        assertTrue(tracker.history("a").isEmpty());
        assertTrue(tracker.latest("a").isEmpty());
    }

    @Test
    void blankSession_rejected() {
        assertThrows(IllegalArgumentException.class, () -> tracker.observer(" "));
    }
}
