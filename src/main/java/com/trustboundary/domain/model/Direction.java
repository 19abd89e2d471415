package com.trustboundary.domain.model;

public enum Direction {
    INBOUND,
    OUTBOUND,
    BIDIRECTIONAL
}
