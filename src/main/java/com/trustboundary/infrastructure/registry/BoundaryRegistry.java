package com.trustboundary.infrastructure.registry;

import com.trustboundary.domain.model.Boundary;

import java.util.Collection;
import java.util.Optional;

/**
 * Read access to boundary definitions. The registry owns boundaries; callers never mutate them.
 */
public interface BoundaryRegistry {

    Optional<Boundary> get(String boundaryId);

    /**
     * Ids of every registered boundary, used by scheduled sweeps.
     */
    Collection<String> boundaryIds();
}
