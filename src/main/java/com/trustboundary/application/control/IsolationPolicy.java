package com.trustboundary.application.control;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.Control;
import com.trustboundary.domain.model.CrossingRequest;

import java.util.Optional;

/**
 * Isolation rule consulted by {@code isolation} controls.
 */
@FunctionalInterface
public interface IsolationPolicy {

    /**
     * @return the reason the crossing breaches isolation of {@code target}, or empty when it is allowed
     */
    Optional<String> breach(Control control, CrossingRequest request, Boundary target);
}
