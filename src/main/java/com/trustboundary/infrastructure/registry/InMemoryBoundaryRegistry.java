package com.trustboundary.infrastructure.registry;

import com.trustboundary.domain.model.Boundary;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

@Slf4j
public class InMemoryBoundaryRegistry implements BoundaryRegistry {

    private final Map<String, Boundary> boundaries = new ConcurrentSkipListMap<>();

    @Override
    public Optional<Boundary> get(String boundaryId) {
        return boundaryId == null ? Optional.empty() : Optional.ofNullable(boundaries.get(boundaryId));
    }

    @Override
    public Collection<String> boundaryIds() {
        return List.copyOf(boundaries.keySet());
    }

    /**
     * Register or replace a boundary definition.
     */
    public void register(Boundary boundary) {
        Objects.requireNonNull(boundary, "boundary must not be null");
        if (boundary.getBoundaryId() == null || boundary.getBoundaryId().isBlank()) {
            throw new IllegalArgumentException("Boundary id is required");
        }
        Boundary previous = boundaries.put(boundary.getBoundaryId(), boundary);
        log.info("{} boundary {} (v{})", previous == null ? "Registered" : "Replaced",
            boundary.getBoundaryId(), boundary.getVersion());
    }

    public boolean remove(String boundaryId) {
        return boundaries.remove(boundaryId) != null;
    }
}
