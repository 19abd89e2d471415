package com.trustboundary.infrastructure.validation;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.VerificationRecord;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema validation backed by the Jakarta Bean Validation constraints declared on
 * the domain model. Each schema id is bound to the model type it describes.
 */
@Slf4j
@RequiredArgsConstructor
public class BeanValidationSchemaValidator implements SchemaValidator {

    private static final Map<String, Class<?>> SCHEMAS = Map.of(
        TRUST_BOUNDARY, Boundary.class,
        BOUNDARY_INTEGRITY, VerificationRecord.class);

    private final Validator validator;

    @Override
    public SchemaValidationResult validate(Object record, String schemaId) {
        Class<?> schemaType = SCHEMAS.get(schemaId);
        if (schemaType == null) {
            return SchemaValidationResult.invalid(List.of("Unknown schema: " + schemaId));
        }
        if (record == null) {
            return SchemaValidationResult.invalid(List.of("Record is null"));
        }
        if (!schemaType.isInstance(record)) {
            return SchemaValidationResult.invalid(List.of(
                "Schema " + schemaId + " describes " + schemaType.getSimpleName()
                    + ", got " + record.getClass().getSimpleName()));
        }

        Set<ConstraintViolation<Object>> violations = validator.validate(record);
        if (violations.isEmpty()) {
            return SchemaValidationResult.ok();
        }

        List<String> errors = violations.stream()
            .map(v -> v.getPropertyPath() + ": " + v.getMessage())
            .sorted(Comparator.naturalOrder())
            .toList();
        log.debug("Record failed {}: {}", schemaId, errors);
        return SchemaValidationResult.invalid(errors);
    }
}
