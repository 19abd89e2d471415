package com.trustboundary.domain.model;

public enum RecommendationKind {
    CONTROL_ENHANCEMENT,
    SEAL_RENEWAL,
    MUTATION_INVESTIGATION,
    ATTESTATION_UPDATE,
    COMPLIANCE_IMPROVEMENT,
    BOUNDARY_REDEFINITION,
    MONITORING_ENHANCEMENT
}
