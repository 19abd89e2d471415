package com.trustboundary.domain.model;

public enum ViolationKind {
    CONTROL_BYPASS,
    SEAL_BROKEN,
    UNAUTHORIZED_MUTATION,
    INVALID_ATTESTATION,
    COMPLIANCE_FAILURE
}
