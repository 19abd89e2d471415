package com.trustboundary.infrastructure.validation;

/**
 * Validates governance records against a named schema.
 */
public interface SchemaValidator {

    String TRUST_BOUNDARY = "trust_boundary.v1";
    String BOUNDARY_INTEGRITY = "boundary_integrity.v1";

    /**
     * @param record record to validate
     * @param schemaId schema identifier, e.g. {@link #TRUST_BOUNDARY}
     * @return validation outcome; an unknown schema is reported as invalid, not thrown
     */
    SchemaValidationResult validate(Object record, String schemaId);
}
