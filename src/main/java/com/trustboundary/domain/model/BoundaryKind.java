package com.trustboundary.domain.model;

/**
 * What kind of perimeter a boundary encloses.
 */
public enum BoundaryKind {
    PROCESS,
    NETWORK,
    DATA,
    USER,
    MODULE,
    GOVERNANCE
}
