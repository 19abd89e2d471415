package com.trustboundary.infrastructure.mutation;

import com.trustboundary.domain.model.Mutation;
import com.trustboundary.domain.model.Severity;
import com.trustboundary.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotMutationDetectorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final SnapshotMutationDetector detector = new SnapshotMutationDetector(clock);

    private static Map<String, Object> state(Object... keyValues) {
        Map<String, Object> state = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            state.put((String) keyValues[i], keyValues[i + 1]);
        }
        return state;
    }

    @Test
    void firstObservationIsBaseline() {
        assertTrue(detector.detect("b1", "trust_boundary", state("status", "ACTIVE")).isEmpty());
        assertTrue(detector.detect("b1", "trust_boundary", state("status", "ACTIVE")).isEmpty());
    }

    @Test
    void changesAreClassifiedBySeverity() {
        detector.detect("b1", "trust_boundary", state("classification", "INTERNAL", "status", "ACTIVE",
            "name", "Payments"));

        List<Mutation> mutations = detector.detect("b1", "trust_boundary",
            state("classification", "PUBLIC", "status", "DEPRECATED", "description", "added later"));

        assertEquals(4, mutations.size());
        Map<String, Mutation> byField = new HashMap<>();
        for (Mutation mutation : mutations) {
            String field = mutation.getDetails().substring(mutation.getDetails().indexOf('\'') + 1,
                mutation.getDetails().lastIndexOf('\''));
            byField.put(field, mutation);
        }
        assertEquals(Severity.HIGH, byField.get("classification").getSeverity());
        assertEquals("field_modified", byField.get("classification").getMutationType());
        assertEquals(Severity.MEDIUM, byField.get("status").getSeverity());
        assertEquals("field_added", byField.get("description").getMutationType());
        assertEquals(Severity.LOW, byField.get("description").getSeverity());
        assertEquals("field_removed", byField.get("name").getMutationType());
        assertEquals(clock.instant(), byField.get("name").getDetectedAt());
    }

    @Test
    void bookkeepingTimestampIsIgnored() {
        detector.detect("b1", "trust_boundary", state("updatedAt", "2024-01-01T00:00:00Z"));

        assertTrue(detector.detect("b1", "trust_boundary", state("updatedAt", "2024-02-01T00:00:00Z")).isEmpty());
    }

    @Test
    void changeIsReportedUntilAccepted() {
        detector.detect("b1", "trust_boundary", state("version", "1.0.0"));
        Map<String, Object> changed = state("version", "1.1.0");

        assertEquals(1, detector.detect("b1", "trust_boundary", changed).size());
        assertEquals(1, detector.detect("b1", "trust_boundary", changed).size());

        detector.acceptBaseline("b1", "trust_boundary", changed);
        assertTrue(detector.detect("b1", "trust_boundary", changed).isEmpty());
    }

    @Test
    void entitiesAreTrackedSeparately() {
        detector.detect("b1", "trust_boundary", state("version", "1.0.0"));

        assertTrue(detector.detect("b2", "trust_boundary", state("version", "2.0.0")).isEmpty());
        assertTrue(detector.detect("b1", "crossing", state("version", "9.9.9")).isEmpty());
    }
}
