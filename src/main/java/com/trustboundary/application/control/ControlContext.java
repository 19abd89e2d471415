package com.trustboundary.application.control;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.CrossingRequest;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * What a control is evaluated against: a crossing into a boundary, or the
 * boundary's own configuration during an integrity verification.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ControlContext {

    /** {@code null} in a verification context. */
    CrossingRequest request;
    Boundary boundary;

    public static ControlContext forCrossing(CrossingRequest request, Boundary target) {
        return new ControlContext(
            Objects.requireNonNull(request, "request must not be null"),
            Objects.requireNonNull(target, "target must not be null"));
    }

    public static ControlContext forVerification(Boundary boundary) {
        return new ControlContext(null, Objects.requireNonNull(boundary, "boundary must not be null"));
    }

    public boolean isCrossing() {
        return request != null;
    }
}
