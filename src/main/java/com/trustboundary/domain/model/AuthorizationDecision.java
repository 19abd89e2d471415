package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Who allowed or denied a crossing, when and why. Recorded at most once per request.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthorizationDecision {

    public enum Decision {
        ALLOW,
        DENY
    }

    Decision decision;
    String authorizerId;
    Instant decidedAt;
    String reason;
}
