package com.trustboundary.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Sensitivity classification of a boundary or of a crossing payload.
 *
 * <p>Ordered from least to most restrictive; {@link #ordinal()} is meaningful.
 */
public enum Classification {
    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED,
    CRITICAL;

    /**
     * Parse a free-form classification tag (as carried by payloads).
     *
     * @param tag tag value, any case; may be {@code null}
     * @return the classification, or empty when the tag is absent or unrecognized
     */
    public static Optional<Classification> fromTag(Object tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.toString().trim().toUpperCase(Locale.ROOT);
        for (Classification value : values()) {
            if (value.name().equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
