package com.trustboundary.infrastructure.mutation;

import com.trustboundary.domain.model.Mutation;

import java.util.List;
import java.util.Map;

/**
 * Detects changes to an entity's state since it was last observed.
 */
public interface MutationDetector {

    /**
     * @param entityId identity of the entity
     * @param entityType kind of entity, e.g. {@code trust_boundary}
     * @param currentState full current state as a property map
     * @return detected mutations; empty when nothing changed
     */
    List<Mutation> detect(String entityId, String entityType, Map<String, Object> currentState);
}
