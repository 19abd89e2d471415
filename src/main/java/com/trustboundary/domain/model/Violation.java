package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An integrity violation. Always attached to exactly one verification record.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Violation {

    @NotBlank
    String violationId;

    @NotNull
    ViolationKind kind;

    @NotNull
    Severity severity;

    String details;
    String evidence;
    String remediation;

    @NotNull
    Instant detectedAt;
}
