package com.trustboundary.infrastructure.attestation;

import com.trustboundary.domain.model.Attestation;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.SealService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attestation authority kept in process memory.
 *
 * <p>Each attestation is sealed over its subject, attester, claims and validity
 * window. Verification recomputes that seal, so an attestation whose claims were
 * altered after issuance fails even though it is still present.
 */
@Slf4j
public class InMemoryAttestationService implements AttestationService {

    private final SealService sealService;
    private final CanonicalJson canonicalJson;
    private final Clock clock;
    private final Duration validity;
    private final Map<String, Attestation> attestations = new ConcurrentHashMap<>();

    public InMemoryAttestationService(SealService sealService, CanonicalJson canonicalJson,
                                      Clock clock, Duration validity) {
        this.sealService = Objects.requireNonNull(sealService, "sealService must not be null");
        this.canonicalJson = Objects.requireNonNull(canonicalJson, "canonicalJson must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (validity == null || validity.isNegative() || validity.isZero()) {
            throw new IllegalArgumentException("Attestation validity must be positive");
        }
        this.validity = validity;
    }

    @Override
    public Optional<Attestation> get(String attestationId) {
        return attestationId == null ? Optional.empty() : Optional.ofNullable(attestations.get(attestationId));
    }

    @Override
    public boolean verify(String attestationId) {
        Attestation attestation = get(attestationId).orElse(null);
        if (attestation == null) {
            log.debug("Attestation {} not found", attestationId);
            return false;
        }
        if (attestation.isRevoked()) {
            log.debug("Attestation {} is revoked: {}", attestationId, attestation.getRevocationReason());
            return false;
        }
        if (attestation.getExpiresAt() != null && !clock.instant().isBefore(attestation.getExpiresAt())) {
            log.debug("Attestation {} expired at {}", attestationId, attestation.getExpiresAt());
            return false;
        }
        return sealService.verify(sealedContent(attestation), attestation.getSignature());
    }

    @Override
    public Attestation issue(String subjectId, String attesterId, Map<String, Object> claims) {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(attesterId, "attesterId must not be null");

        Instant now = clock.instant();
        Attestation unsigned = Attestation.builder()
            .attestationId("att_" + UUID.randomUUID())
            .subjectId(subjectId)
            .attesterId(attesterId)
            .claims(claims)
            .issuedAt(now)
            .expiresAt(now.plus(validity))
            .build();
        Attestation issued = unsigned.toBuilder()
            .signature(sealService.create(sealedContent(unsigned)))
            .build();

        attestations.put(issued.getAttestationId(), issued);
        log.info("Issued attestation {} for {} by {}", issued.getAttestationId(), subjectId, attesterId);
        return issued;
    }

    /**
     * Register an attestation issued elsewhere, e.g. one restored from a registry export.
     */
    public void register(Attestation attestation) {
        Objects.requireNonNull(attestation.getAttestationId(), "attestationId must not be null");
        attestations.put(attestation.getAttestationId(), attestation);
    }

    /**
     * Revoke an attestation. Revoked attestations stay retrievable but no longer verify.
     *
     * @return {@code false} when the attestation does not exist
     */
    public boolean revoke(String attestationId, String reason) {
        Attestation existing = attestations.get(attestationId);
        if (existing == null) {
            return false;
        }
        attestations.put(attestationId, existing.toBuilder().revoked(true).revocationReason(reason).build());
        log.warn("Revoked attestation {}: {}", attestationId, reason);
        return true;
    }

    private String sealedContent(Attestation attestation) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("attestation_id", attestation.getAttestationId());
        content.put("subject_id", attestation.getSubjectId());
        content.put("attester_id", attestation.getAttesterId());
        content.put("claims", attestation.getClaims());
        content.put("issued_at", attestation.getIssuedAt());
        content.put("expires_at", attestation.getExpiresAt());
        return canonicalJson.write(content);
    }
}
