package com.trustboundary.domain.model;

public enum ImpactLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Next level up, saturating at {@link #HIGH}.
     */
    public ImpactLevel raise() {
        return this == HIGH ? HIGH : values()[ordinal() + 1];
    }
}
