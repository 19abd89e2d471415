package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One governance requirement checked against a boundary definition.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceCheck {
    String requirementId;
    boolean compliant;
    String details;
    String evidence;
}
