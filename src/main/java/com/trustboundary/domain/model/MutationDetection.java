package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A mutation reported by the mutation detector, as carried on a verification record.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MutationDetection {
    String mutationId;
    String mutationType;
    Instant detectedAt;
    Severity severity;
    String details;
    String evidence;
}
