package com.trustboundary.domain.model;

/**
 * Severity of a violation or a detected mutation.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * High and critical severities count as critical failures when scoring integrity.
     */
    public boolean atLeastHigh() {
        return this == HIGH || this == CRITICAL;
    }
}
