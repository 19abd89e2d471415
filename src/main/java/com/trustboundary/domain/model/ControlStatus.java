package com.trustboundary.domain.model;

/**
 * Outcome of evaluating one control.
 *
 * <p>Only {@link #INEFFECTIVE} blocks a crossing. {@link #DEGRADED} and
 * {@link #WARNING} are reported but let evaluation continue.
 */
public enum ControlStatus {
    EFFECTIVE,
    INEFFECTIVE,
    DEGRADED,
    WARNING
}
