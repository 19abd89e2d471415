package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of evaluating one control, with the evidence behind it.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ControlEvaluation {
    String controlId;
    ControlKind controlType;
    ControlStatus status;
    String detail;
    String evidence;

    public boolean blocksCrossing() {
        return status == ControlStatus.INEFFECTIVE;
    }
}
