package com.trustboundary.infrastructure.validation;

import lombok.Value;

import java.util.List;

@Value
public class SchemaValidationResult {
    boolean valid;
    List<String> errors;

    public static SchemaValidationResult ok() {
        return new SchemaValidationResult(true, List.of());
    }

    public static SchemaValidationResult invalid(List<String> errors) {
        return new SchemaValidationResult(false, List.copyOf(errors));
    }
}
