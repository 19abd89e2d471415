package com.trustboundary.domain.model;

/**
 * Lifecycle of a crossing request.
 *
 * <pre>
 * requested -> validating -> (validation_failed | validated)
 * validated -> authorization_pending -> (denied | authorized)
 * authorized -> executing -> (completed | failed)
 * </pre>
 *
 * <p>{@code validating -> failed} is the single shortcut and is reserved for a
 * target boundary that does not exist. Transitions only move forward.
 */
public enum CrossingStatus {
    REQUESTED,
    VALIDATING,
    VALIDATION_FAILED,
    VALIDATED,
    AUTHORIZATION_PENDING,
    DENIED,
    AUTHORIZED,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return switch (this) {
            case VALIDATION_FAILED, DENIED, COMPLETED, FAILED -> true;
            case REQUESTED, VALIDATING, VALIDATED, AUTHORIZATION_PENDING, AUTHORIZED, EXECUTING -> false;
        };
    }

    public boolean canTransitionTo(CrossingStatus next) {
        return switch (this) {
            case REQUESTED -> next == VALIDATING;
            case VALIDATING -> next == VALIDATION_FAILED || next == VALIDATED || next == FAILED;
            case VALIDATED -> next == AUTHORIZATION_PENDING;
            case AUTHORIZATION_PENDING -> next == DENIED || next == AUTHORIZED;
            case AUTHORIZED -> next == EXECUTING;
            case EXECUTING -> next == COMPLETED || next == FAILED;
            case VALIDATION_FAILED, DENIED, COMPLETED, FAILED -> false;
        };
    }
}
