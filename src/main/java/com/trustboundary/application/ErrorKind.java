package com.trustboundary.application;

/**
 * Ordinary, non-fatal failure categories returned in a {@link Result}.
 */
public enum ErrorKind {
    /** Boundary, request or verification absent. */
    NOT_FOUND,
    /** Input or record failed schema or argument validation. */
    VALIDATION_FAILED,
    /** Operation not legal in the entity's current state. */
    INVALID_STATE,
    /** Caller may not perform the operation now. */
    UNAUTHORIZED
}
