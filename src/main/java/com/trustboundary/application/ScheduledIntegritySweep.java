package com.trustboundary.application;

import com.trustboundary.application.exceptions.UnpersistedVerificationException;
import com.trustboundary.domain.model.VerificationKind;
import com.trustboundary.infrastructure.registry.BoundaryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic comprehensive verification of every registered boundary.
 *
 * <p>Disabled unless {@code governance.verification.schedule.enabled=true}. A
 * failure on one boundary is logged and the sweep moves on to the next.
 */
@Component
@ConditionalOnProperty(prefix = "governance.verification.schedule", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class ScheduledIntegritySweep {

    private final BoundaryRegistry boundaryRegistry;
    private final BoundaryIntegrityVerifier verifier;

    @Scheduled(fixedDelayString = "${governance.verification.schedule.interval-ms:86400000}",
               initialDelayString = "${governance.verification.schedule.interval-ms:86400000}")
    public void run() {
        int verified = sweep();
        log.info("Scheduled integrity sweep verified {} boundary(ies)", verified);
    }

    /**
     * @return number of boundaries for which a record was stored
     */
    public int sweep() {
        int verified = 0;
        for (String boundaryId : boundaryRegistry.boundaryIds()) {
            try {
                Result<?> result = verifier.verify(boundaryId, VerificationKind.COMPREHENSIVE,
                    BoundaryIntegrityVerifier.TRIGGER_SCHEDULED);
                if (result.isOk()) {
                    verified++;
                } else {
                    log.warn("Scheduled verification of {} skipped: {}", boundaryId, result.message());
                }
            } catch (UnpersistedVerificationException e) {
                log.error("Scheduled verification of {} was not stored", boundaryId, e);
            } catch (RuntimeException e) {
                log.error("Scheduled verification of {} failed", boundaryId, e);
            }
        }
        return verified;
    }
}
