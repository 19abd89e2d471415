package com.trustboundary.domain.model;

/**
 * Lifecycle status of a boundary definition.
 */
public enum BoundaryStatus {
    DRAFT,
    ACTIVE,
    DEPRECATED,
    RETIRED
}
