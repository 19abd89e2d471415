package com.trustboundary.infrastructure.validation;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.ControlKind;
import com.trustboundary.domain.model.IntegrityStatus;
import com.trustboundary.domain.model.VerificationKind;
import com.trustboundary.domain.model.VerificationRecord;
import com.trustboundary.support.Boundaries;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BeanValidationSchemaValidatorTest {

    private static ValidatorFactory factory;
    private static SchemaValidator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new BeanValidationSchemaValidator(factory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void compliantBoundaryPasses() {
        SchemaValidationResult result = validator.validate(Boundaries.compliant("b1").build(),
            SchemaValidator.TRUST_BOUNDARY);

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void errorsNamePathAndAreSorted() {
        Boundary broken = Boundaries.compliant("b1")
            .version("v1")
            .name("")
            .control(Boundaries.control("", ControlKind.LOGGING))
            .build();

        SchemaValidationResult result = validator.validate(broken, SchemaValidator.TRUST_BOUNDARY);

        assertFalse(result.isValid());
        assertEquals(3, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith("controls[0].controlId: "));
        assertTrue(result.getErrors().get(1).startsWith("name: "));
        assertTrue(result.getErrors().get(2).startsWith("version: "));
    }

    @Test
    void verificationRecordConfidenceIsBounded() {
        VerificationRecord record = VerificationRecord.builder()
            .verificationId("verification-1")
            .boundaryId("b1")
            .timestamp(Instant.parse("2024-03-01T12:00:00Z"))
            .verificationKind(VerificationKind.COMPREHENSIVE)
            .verifierId("boundary-integrity-verifier")
            .triggeredBy("manual")
            .integrityStatus(IntegrityStatus.INTACT)
            .confidence(1.5)
            .build();

        SchemaValidationResult result = validator.validate(record, SchemaValidator.BOUNDARY_INTEGRITY);

        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith("confidence: "));
    }

    @Test
    void schemaMismatchIsInvalid() {
        assertFalse(validator.validate(Boundaries.compliant("b1").build(), SchemaValidator.BOUNDARY_INTEGRITY).isValid());
        assertFalse(validator.validate(Boundaries.compliant("b1").build(), "unknown.v1").isValid());
        assertEquals(List.of("Record is null"), validator.validate(null, SchemaValidator.TRUST_BOUNDARY).getErrors());
    }
}
