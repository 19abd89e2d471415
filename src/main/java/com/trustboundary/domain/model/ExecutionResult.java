package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Outcome of performing a crossing.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {

    public static final String BOUNDARY_NOT_FOUND = "BOUNDARY_NOT_FOUND";
    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";

    boolean success;

    @Singular(value = "resultEntry", ignoreNullCollections = true)
    Map<String, Object> resultData;

    String errorCode;
    String errorMessage;

    public static ExecutionResult succeeded(Map<String, Object> resultData) {
        return ExecutionResult.builder().success(true).resultData(resultData).build();
    }

    public static ExecutionResult failed(String errorCode, String errorMessage) {
        return ExecutionResult.builder()
            .success(false)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
