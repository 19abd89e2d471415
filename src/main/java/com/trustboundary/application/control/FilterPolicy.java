package com.trustboundary.application.control;

import com.trustboundary.domain.model.Control;
import com.trustboundary.domain.model.CrossingRequest;

import java.util.Optional;

/**
 * Content filter consulted by {@code filtering} controls.
 */
@FunctionalInterface
public interface FilterPolicy {

    /**
     * @return the reason the payload is rejected, or empty when it may pass
     */
    Optional<String> reject(Control control, CrossingRequest request);
}
