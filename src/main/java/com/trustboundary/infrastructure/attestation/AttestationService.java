package com.trustboundary.infrastructure.attestation;

import com.trustboundary.domain.model.Attestation;

import java.util.Map;
import java.util.Optional;

/**
 * Issues and verifies third-party attestations.
 *
 * <p>Lookups and verification are failure-shaped: an unknown id is an empty
 * result or {@code false}, never an exception.
 */
public interface AttestationService {

    Optional<Attestation> get(String attestationId);

    /**
     * @return {@code true} only if the attestation exists, is neither revoked nor
     *         expired, and its seal matches its claims
     */
    boolean verify(String attestationId);

    /**
     * Issue a new attestation about {@code subjectId}.
     */
    Attestation issue(String subjectId, String attesterId, Map<String, Object> claims);
}
