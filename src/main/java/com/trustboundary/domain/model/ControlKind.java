package com.trustboundary.domain.model;

/**
 * Kinds of guard that can be attached to a boundary.
 */
public enum ControlKind {
    AUTHENTICATION,
    AUTHORIZATION,
    ENCRYPTION,
    VALIDATION,
    MONITORING,
    LOGGING,
    FILTERING,
    RATE_LIMITING,
    ISOLATION
}
