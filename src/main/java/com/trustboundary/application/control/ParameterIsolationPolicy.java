package com.trustboundary.application.control;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.Control;
import com.trustboundary.domain.model.CrossingRequest;

import java.util.List;
import java.util.Optional;

/**
 * Admits only crossings whose source boundary is listed in {@code allowed_sources}.
 * A control without that parameter isolates nothing.
 */
public class ParameterIsolationPolicy implements IsolationPolicy {

    @Override
    public Optional<String> breach(Control control, CrossingRequest request, Boundary target) {
        List<String> allowed = control.listParam("allowed_sources");
        if (allowed.isEmpty() || allowed.contains(request.getSourceBoundaryId())) {
            return Optional.empty();
        }
        return Optional.of("Source " + request.getSourceBoundaryId()
            + " is not admitted into " + target.getBoundaryId());
    }
}
