package com.trustboundary.infrastructure.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HmacSealServiceTest {

    private static final byte[] KEY = "unit-test-seal-key-0123456789".getBytes(StandardCharsets.UTF_8);

    private HmacSealService sealService;

    @BeforeEach
    void setUp() {
        sealService = new HmacSealService(KEY, "HmacSHA256",
            Map.of("BoundaryCrossingProtocol", Set.of("submit", "authorize")), new ObjectMapper());
    }

    @Test
    void sealVerifiesOnlyItsOwnContent() {
        String seal = sealService.create("{\"a\":1}");

        assertTrue(seal.startsWith("hmacsha256:"));
        assertTrue(sealService.verify("{\"a\":1}", seal));
        assertFalse(sealService.verify("{\"a\":2}", seal));
    }

    @Test
    void sealFromAnotherKeyIsRejected() {
        HmacSealService other = new HmacSealService("another-seal-key-9876543210".getBytes(StandardCharsets.UTF_8),
            "HmacSHA256", Map.of(), new ObjectMapper());

        String foreign = other.create("content");

        assertNotEquals(foreign, sealService.create("content"));
        assertFalse(sealService.verify("content", foreign));
    }

    @Test
    void malformedSealsAreRejected() {
        assertFalse(sealService.verify("content", null));
        assertFalse(sealService.verify("content", "sha1:abc"));
        assertFalse(sealService.verify("content", "hmacsha256:not base64!"));
        assertFalse(sealService.verify(null, sealService.create("content")));
    }

    @Test
    void shortKeysAreRefused() {
        assertThrows(IllegalArgumentException.class,
            () -> new HmacSealService(new byte[8], "HmacSHA256", Map.of(), new ObjectMapper()));
    }

    @Test
    void unknownAlgorithmFailsAtConstruction() {
        assertThrows(HmacSealService.SealException.class,
            () -> new HmacSealService(KEY, "HmacNope", Map.of(), new ObjectMapper()));
    }

    @Test
    void tetherAllowsOnlyContractedOperations() {
        String snapshot = "{\"operation\":\"submit\",\"record_count\":3,\"timestamp\":\"2024-03-01T12:00:00Z\"}";

        assertTrue(sealService.verifyContractTether("BoundaryCrossingProtocol", "submit", snapshot));
        assertFalse(sealService.verifyContractTether("BoundaryCrossingProtocol", "execute",
            snapshot.replace("submit", "execute")));
        assertFalse(sealService.verifyContractTether("BoundaryIntegrityVerifier", "submit", snapshot));
    }

    @Test
    void tetherRejectsInconsistentSnapshots() {
        assertFalse(sealService.verifyContractTether("BoundaryCrossingProtocol", "authorize",
            "{\"operation\":\"submit\",\"record_count\":3,\"timestamp\":\"2024-03-01T12:00:00Z\"}"));
        assertFalse(sealService.verifyContractTether("BoundaryCrossingProtocol", "submit",
            "{\"operation\":\"submit\",\"record_count\":-1,\"timestamp\":\"2024-03-01T12:00:00Z\"}"));
        assertFalse(sealService.verifyContractTether("BoundaryCrossingProtocol", "submit",
            "{\"operation\":\"submit\",\"record_count\":0}"));
        assertFalse(sealService.verifyContractTether("BoundaryCrossingProtocol", "submit", "not json"));
    }
}
