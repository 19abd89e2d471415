package com.trustboundary.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Pointer to an attestation held by the attestation service.
 */
@Value
@Builder
@Jacksonized
public class AttestationReference {
    String attestationId;

    public static AttestationReference of(String attestationId) {
        return new AttestationReference(attestationId);
    }
}
