package com.trustboundary.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Which check categories a verification run covers.
 *
 * <p>Every constant except {@link #COMPREHENSIVE} names a single category;
 * {@code COMPREHENSIVE} covers all five.
 */
public enum VerificationKind {
    CONTROL_VERIFICATION,
    SEAL_VALIDATION,
    MUTATION_DETECTION,
    ATTESTATION_VERIFICATION,
    COMPLIANCE_CHECKING,
    COMPREHENSIVE;

    public boolean covers(VerificationKind category) {
        return this == COMPREHENSIVE || this == category;
    }

    /**
     * Single categories covered by this kind, in evaluation order.
     */
    public List<VerificationKind> categories() {
        return Arrays.stream(values())
            .filter(kind -> kind != COMPREHENSIVE && covers(kind))
            .toList();
    }
}
