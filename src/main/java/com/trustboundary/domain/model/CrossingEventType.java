package com.trustboundary.domain.model;

import java.util.Locale;

/**
 * Event types recorded on a crossing's audit trail.
 */
public enum CrossingEventType {
    REQUEST_RECEIVED,
    VALIDATED,
    VALIDATION_FAILED,
    AUTHORIZATION_PENDING,
    AUTHORIZED,
    DENIED,
    EXECUTING,
    IMPACT_ASSESSED,
    COMPLETED,
    FAILED;

    /**
     * Event that records entry into the given status.
     */
    public static CrossingEventType enteringStatus(CrossingStatus status) {
        return switch (status) {
            case VALIDATING -> REQUEST_RECEIVED;
            case VALIDATION_FAILED -> VALIDATION_FAILED;
            case VALIDATED -> VALIDATED;
            case AUTHORIZATION_PENDING -> AUTHORIZATION_PENDING;
            case DENIED -> DENIED;
            case AUTHORIZED -> AUTHORIZED;
            case EXECUTING -> EXECUTING;
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case REQUESTED -> throw new IllegalArgumentException("No event enters " + status);
        };
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
