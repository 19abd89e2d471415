package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Suggested remediation, with ordered implementation steps.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {

    @NotBlank
    String recommendationId;

    @NotNull
    RecommendationKind kind;

    @NotNull
    Priority priority;

    String description;

    @Singular(ignoreNullCollections = true)
    List<String> steps;
}
