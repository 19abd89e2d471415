package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SealValidation {

    /** Seal id used for the boundary's own signature. */
    public static final String BOUNDARY_SIGNATURE = "boundary-signature";

    String sealId;
    boolean valid;
    String details;
    String evidence;
}
