package com.trustboundary.domain.model;

/**
 * Why trust was decayed after a crossing.
 */
public enum TrustDecayReason {
    DENIED,
    FAILED,
    UNAUTHORIZED
}
