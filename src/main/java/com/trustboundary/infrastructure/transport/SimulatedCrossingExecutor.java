package com.trustboundary.infrastructure.transport;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.CrossingRequest;
import com.trustboundary.domain.model.ExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executor used when no real transport is wired: the crossing always succeeds
 * and the result echoes what would have been delivered.
 */
@Slf4j
public class SimulatedCrossingExecutor implements CrossingExecutor {

    @Override
    public ExecutionResult execute(CrossingRequest request, Boundary target) {
        log.debug("Simulating {} crossing {} into {}",
            request.getCrossingKind(), request.getRequestId(), target.getBoundaryId());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("delivered", true);
        result.put("payload_entries", request.getPayload().size());
        result.put("target", target.getBoundaryId());
        return ExecutionResult.succeeded(result);
    }
}
