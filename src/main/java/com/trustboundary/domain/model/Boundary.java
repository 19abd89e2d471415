package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A declared trust perimeter.
 *
 * <p>Boundaries are owned by the external registry; this module only reads them.
 * Enum-typed fields are {@code null} when the registry supplied a missing or
 * unrecognized value, so compliance checking can report the defect instead of
 * the lookup failing.
 *
 * <p><strong>Invariants checked by compliance, not by construction:</strong>
 * <ul>
 *   <li>identity, name, description, kind, classification, timestamps, version and status present</li>
 *   <li>version matches {@code MAJOR.MINOR.PATCH}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Boundary {

    @NotBlank
    String boundaryId;

    @NotBlank
    String name;

    String description;

    @NotNull
    BoundaryKind boundaryType;

    @NotNull
    Classification classification;

    @NotNull
    BoundaryStatus status;

    @NotBlank
    @Pattern(regexp = "^\\d+\\.\\d+\\.\\d+$")
    String version;

    Instant createdAt;

    Instant updatedAt;

    /**
     * Controls in declaration order; evaluation follows this order.
     */
    @Valid
    @Singular(ignoreNullCollections = true)
    List<Control> controls;

    /**
     * Self-signature over the registry definition without this field.
     */
    String signature;

    @Singular(ignoreNullCollections = true)
    List<Seal> seals;

    @Singular(ignoreNullCollections = true)
    List<AttestationReference> attestations;

    /**
     * Registry document this boundary was read from, including fields the model
     * does not carry. {@code null} for boundaries built in code.
     */
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Map<String, Object> definition;
}
