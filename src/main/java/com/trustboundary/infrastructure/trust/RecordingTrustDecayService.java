package com.trustboundary.infrastructure.trust;

import com.trustboundary.domain.model.TrustDecayEvent;
import com.trustboundary.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, in-memory record of trust decay.
 */
@Slf4j
@RequiredArgsConstructor
public class RecordingTrustDecayService implements TrustDecayService {

    private final AuditService auditService;
    private final List<TrustDecayEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void recordDecay(TrustDecayEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        events.add(event);
        log.debug("Trust decay {} of {} against {}", event.getReason(), event.getMagnitude(), event.getEntityId());
        auditService.record(AuditService.TRUST_DECAY, "DECAYED", event.getEntityId(), null,
            event.getReason() + " magnitude=" + event.getMagnitude() + " request=" + event.getRequestId());
    }

    @Override
    public List<TrustDecayEvent> history(String entityId) {
        return events.stream()
            .filter(e -> Objects.equals(entityId, e.getEntityId()))
            .toList();
    }

    /**
     * Sum of decay magnitudes recorded against an entity.
     */
    public double totalDecay(String entityId) {
        return history(entityId).stream().mapToDouble(TrustDecayEvent::getMagnitude).sum();
    }
}
