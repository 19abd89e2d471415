package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A typed guard attached to a boundary.
 *
 * <p>Parameters are implementation specific and interpreted per {@link ControlKind}
 * by the control evaluator. A control is immutable for the duration of an evaluation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Control {

    @NotBlank
    String controlId;

    @NotNull
    ControlKind controlType;

    @Singular(ignoreNullCollections = true)
    Map<String, Object> parameters;

    /**
     * Raw parameter value, or {@code null} when absent.
     */
    public Object param(String name) {
        return parameters.get(name);
    }

    /**
     * Boolean parameter. Accepts booleans and their string forms.
     */
    public boolean flag(String name, boolean defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Integer parameter, or {@code defaultValue} when absent or not numeric.
     */
    public int intParam(String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * List-of-strings parameter. A single scalar is treated as a one-element list.
     */
    public List<String> listParam(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }
}
