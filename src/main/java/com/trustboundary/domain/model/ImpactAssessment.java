package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Post-execution assessment of what a crossing did to trust, security,
 * governance and performance.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImpactAssessment {
    /** Signed; negative values erode trust. */
    double trustImpact;
    ImpactLevel securityImpact;
    ImpactLevel governanceImpact;
    ImpactLevel performanceImpact;
    String rationale;
    Instant assessedAt;
}
