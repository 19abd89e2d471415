package com.trustboundary.domain.model;

/**
 * What a crossing moves across the boundary.
 */
public enum CrossingKind {
    DATA_TRANSFER,
    CONTROL_TRANSFER,
    AUTHENTICATION,
    AUTHORIZATION,
    API_CALL,
    DATA_ACCESS
}
