package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Result of one integrity verification run against a boundary.
 *
 * <p>Immutable once signed. A re-check produces a new record instead of editing
 * an existing one. {@link #signature} covers the record's content with the
 * signature field itself removed.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationRecord {

    @NotBlank
    String verificationId;

    @NotBlank
    String boundaryId;

    @NotNull
    Instant timestamp;

    @NotNull
    VerificationKind verificationKind;

    @NotBlank
    String verifierId;

    /** {@code manual}, {@code scheduled} or {@code reported}. */
    @NotBlank
    String triggeredBy;

    @Singular(value = "categoryRun", ignoreNullCollections = true)
    List<VerificationKind> categoriesRun;

    @Singular(ignoreNullCollections = true)
    List<ControlEvaluation> controlVerifications;

    @Singular(ignoreNullCollections = true)
    List<SealValidation> sealValidations;

    @Singular(ignoreNullCollections = true)
    List<MutationDetection> mutationDetections;

    @Singular(ignoreNullCollections = true)
    List<AttestationVerification> attestationVerifications;

    @Singular(ignoreNullCollections = true)
    List<ComplianceCheck> complianceChecks;

    @NotNull
    IntegrityStatus integrityStatus;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double confidence;

    @PositiveOrZero
    int totalChecks;

    @PositiveOrZero
    int passedChecks;

    @PositiveOrZero
    int criticalFailures;

    String resultDetails;

    @Valid
    @Singular(ignoreNullCollections = true)
    List<Violation> violations;

    @Valid
    @Singular(ignoreNullCollections = true)
    List<Recommendation> recommendations;

    Instant nextScheduledVerification;

    String signature;

    public VerificationRecord unsigned() {
        return toBuilder().signature(null).build();
    }
}
