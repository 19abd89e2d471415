package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A third-party claim about a subject (a boundary or a crossing request).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attestation {
    String attestationId;
    String subjectId;
    String attesterId;

    @Singular(ignoreNullCollections = true)
    Map<String, Object> claims;

    Instant issuedAt;
    Instant expiresAt;
    boolean revoked;
    String revocationReason;
    String signature;
}
