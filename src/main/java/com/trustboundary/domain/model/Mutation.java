package com.trustboundary.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A change reported by a mutation detector. Any field may be absent.
 */
@Value
@Builder
public class Mutation {
    String mutationId;
    String mutationType;
    Instant detectedAt;
    Severity severity;
    String details;
    String evidence;
}
