package com.trustboundary.infrastructure.trust;

import com.trustboundary.domain.model.TrustDecayEvent;

import java.util.List;

/**
 * Receives trust-decay events emitted by the crossing protocol.
 */
public interface TrustDecayService {

    void recordDecay(TrustDecayEvent event);

    /**
     * Decay events recorded against an entity, oldest first.
     */
    List<TrustDecayEvent> history(String entityId);
}
