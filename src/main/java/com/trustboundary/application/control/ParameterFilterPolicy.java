package com.trustboundary.application.control;

import com.trustboundary.domain.model.Control;
import com.trustboundary.domain.model.CrossingRequest;

import java.util.List;
import java.util.Optional;

/**
 * Rejects payloads carrying any field named in the control's {@code blocked_fields} parameter.
 */
public class ParameterFilterPolicy implements FilterPolicy {

    @Override
    public Optional<String> reject(Control control, CrossingRequest request) {
        List<String> blocked = control.listParam("blocked_fields").stream()
            .filter(request.getPayload()::containsKey)
            .toList();
        return blocked.isEmpty()
            ? Optional.empty()
            : Optional.of("Payload carries blocked field(s) " + blocked);
    }
}
