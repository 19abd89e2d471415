package com.trustboundary.infrastructure.mutation;

import com.trustboundary.domain.model.Mutation;
import com.trustboundary.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Baseline-and-diff mutation detector.
 *
 * <p>The first state observed for an entity becomes its baseline and produces no
 * mutations. Later observations are compared field by field (top level only)
 * against that baseline. The baseline is not advanced automatically: an unapproved
 * change keeps being reported until {@link #acceptBaseline} is called.
 */
@Slf4j
public class SnapshotMutationDetector implements MutationDetector {

    private static final Set<String> HIGH_SEVERITY_FIELDS = Set.of("controls", "classification", "signature", "seals");
    private static final Set<String> MEDIUM_SEVERITY_FIELDS = Set.of("status", "version");

    // Bookkeeping fields that change on every legitimate edit
    private static final Set<String> IGNORED_FIELDS = Set.of("updatedAt");

    private final Clock clock;
    private final Map<String, Map<String, Object>> baselines = new ConcurrentHashMap<>();

    public SnapshotMutationDetector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<Mutation> detect(String entityId, String entityType, Map<String, Object> currentState) {
        String key = entityType + ":" + entityId;
        Map<String, Object> baseline = baselines.putIfAbsent(key, new LinkedHashMap<>(currentState));
        if (baseline == null) {
            log.debug("Recorded baseline for {}", key);
            return List.of();
        }

        Set<String> fields = new TreeSet<>(baseline.keySet());
        fields.addAll(currentState.keySet());
        fields.removeAll(IGNORED_FIELDS);

        Instant now = clock.instant();
        List<Mutation> mutations = new ArrayList<>();
        for (String field : fields) {
            Object before = baseline.get(field);
            Object after = currentState.get(field);
            if (Objects.equals(before, after)) {
                continue;
            }
            mutations.add(Mutation.builder()
                .mutationId("mut_" + UUID.randomUUID())
                .mutationType(mutationType(before, after))
                .detectedAt(now)
                .severity(severityOf(field))
                .details("Field '" + field + "' of " + entityType + " " + entityId + " changed since baseline")
                .evidence("before=" + before + ", after=" + after)
                .build());
        }

        if (!mutations.isEmpty()) {
            log.warn("Detected {} mutation(s) on {}", mutations.size(), key);
        }
        return mutations;
    }

    /**
     * Make the given state the new baseline for an entity, e.g. after an approved change.
     */
    public void acceptBaseline(String entityId, String entityType, Map<String, Object> state) {
        baselines.put(entityType + ":" + entityId, new LinkedHashMap<>(state));
        log.info("Accepted new baseline for {}:{}", entityType, entityId);
    }

    private static String mutationType(Object before, Object after) {
        if (before == null) {
            return "field_added";
        }
        if (after == null) {
            return "field_removed";
        }
        return "field_modified";
    }

    private static Severity severityOf(String field) {
        if (HIGH_SEVERITY_FIELDS.contains(field)) {
            return Severity.HIGH;
        }
        if (MEDIUM_SEVERITY_FIELDS.contains(field)) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
