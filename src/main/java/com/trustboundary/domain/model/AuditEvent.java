package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One timestamped entry in a crossing's audit trail.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {
    String eventId;
    Instant timestamp;
    CrossingEventType eventType;
    String actorId;

    @Singular(ignoreNullCollections = true)
    Map<String, Object> details;
}
