package com.trustboundary.domain.model;

/**
 * Aggregated health of a boundary at the time of a verification.
 */
public enum IntegrityStatus {
    INTACT,
    WARNING,
    COMPROMISED,
    UNKNOWN
}
