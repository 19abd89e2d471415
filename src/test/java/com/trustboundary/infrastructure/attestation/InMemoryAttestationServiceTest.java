package com.trustboundary.infrastructure.attestation;

import com.trustboundary.domain.model.Attestation;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.support.FakeSealService;
import com.trustboundary.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryAttestationServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final InMemoryAttestationService service = new InMemoryAttestationService(
        new FakeSealService(), new CanonicalJson(), clock, Duration.ofDays(30));

    @Test
    void issuedAttestationVerifies() {
        Attestation attestation = service.issue("b1", "auditor-1", Map.of("reviewed", true));

        assertTrue(attestation.getAttestationId().startsWith("att_"));
        assertEquals(clock.instant().plus(Duration.ofDays(30)), attestation.getExpiresAt());
        assertTrue(service.verify(attestation.getAttestationId()));
    }

    @Test
    void expiredAttestationFails() {
        String id = service.issue("b1", "auditor-1", Map.of()).getAttestationId();

        clock.advance(Duration.ofDays(30));

        assertFalse(service.verify(id));
    }

    @Test
    void revokedAttestationStaysVisibleButFails() {
        String id = service.issue("b1", "auditor-1", Map.of()).getAttestationId();

        assertTrue(service.revoke(id, "key compromise"));

        assertTrue(service.get(id).orElseThrow().isRevoked());
        assertFalse(service.verify(id));
        assertFalse(service.revoke("att_missing", "n/a"));
    }

    @Test
    void alteredClaimsFailSealCheck() {
        Attestation issued = service.issue("b1", "auditor-1", Map.of("scope", "read"));

        service.register(issued.toBuilder().clearClaims().claim("scope", "write").build());

        assertFalse(service.verify(issued.getAttestationId()));
    }

    @Test
    void unknownAttestationFails() {
        assertFalse(service.verify("att_missing"));
        assertTrue(service.get(null).isEmpty());
    }

    @Test
    void validityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryAttestationService(
            new FakeSealService(), new CanonicalJson(), clock, Duration.ZERO));
    }
}
