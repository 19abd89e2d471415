package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A scored reduction of an entity's trust, emitted after a denial or failure.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrustDecayEvent {
    String eventId;
    String entityId;
    TrustDecayReason reason;
    double magnitude;
    String requestId;
    Instant occurredAt;
}
