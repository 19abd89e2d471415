package com.trustboundary.infrastructure.transport;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.CrossingRequest;
import com.trustboundary.domain.model.ExecutionResult;

/**
 * Performs an authorized crossing.
 *
 * <p>Implementations report transport failures as a failed {@link ExecutionResult}.
 * The protocol also converts anything thrown here into a failed result, so an
 * exception never leaves a crossing stuck in {@code executing}. Callers that need
 * a timeout must enforce it around the executor.
 */
public interface CrossingExecutor {

    ExecutionResult execute(CrossingRequest request, Boundary target);
}
