package com.trustboundary.application;

import com.trustboundary.application.IntegrityScorer.Findings;
import com.trustboundary.application.IntegrityScorer.Score;
import com.trustboundary.application.control.ControlContext;
import com.trustboundary.application.control.ControlEvaluator;
import com.trustboundary.application.exceptions.UnpersistedVerificationException;
import com.trustboundary.domain.model.AttestationReference;
import com.trustboundary.domain.model.AttestationVerification;
import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.ComplianceCheck;
import com.trustboundary.domain.model.ControlEvaluation;
import com.trustboundary.domain.model.IntegrityStatus;
import com.trustboundary.domain.model.Mutation;
import com.trustboundary.domain.model.MutationDetection;
import com.trustboundary.domain.model.Recommendation;
import com.trustboundary.domain.model.Seal;
import com.trustboundary.domain.model.SealValidation;
import com.trustboundary.domain.model.Severity;
import com.trustboundary.domain.model.VerificationKind;
import com.trustboundary.domain.model.VerificationRecord;
import com.trustboundary.domain.model.Violation;
import com.trustboundary.domain.model.ViolationKind;
import com.trustboundary.domain.repository.VerificationRepository;
import com.trustboundary.infrastructure.attestation.AttestationService;
import com.trustboundary.infrastructure.audit.AuditService;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.SealService;
import com.trustboundary.infrastructure.mutation.MutationDetector;
import com.trustboundary.infrastructure.persistence.PersistenceException;
import com.trustboundary.infrastructure.registry.BoundaryDefinitionLoader;
import com.trustboundary.infrastructure.registry.BoundaryRegistry;
import com.trustboundary.infrastructure.validation.SchemaValidationResult;
import com.trustboundary.infrastructure.validation.SchemaValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Boundary Integrity Verifier.
 *
 * <p>Audits a boundary at a point in time. A run executes the check categories
 * selected by its {@link VerificationKind} (control verification, seal
 * validation, mutation detection, attestation verification, compliance
 * checking), scores them, derives violations and recommendations, signs the
 * resulting {@link VerificationRecord} and appends it to the verification ledger.
 *
 * <p>Checks never throw: a collaborator that fails is recorded as a failed check.
 * A record that was computed but could not be stored is reported with
 * {@link UnpersistedVerificationException}, which carries the record.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BoundaryIntegrityVerifier {

    public static final String COMPONENT = "BoundaryIntegrityVerifier";
    public static final String VERIFIER_ID = "boundary-integrity-verifier";
    public static final String ENTITY_TYPE = "trust_boundary";

    public static final String TRIGGER_MANUAL = "manual";
    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_REPORTED = "reported";

    static final Duration VERIFICATION_INTERVAL = Duration.ofHours(24);

    private static final Pattern VERSION_FORMAT = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Set<String> RUN_TRIGGERS = Set.of(TRIGGER_MANUAL, TRIGGER_SCHEDULED);

    private final BoundaryRegistry boundaryRegistry;
    private final ControlEvaluator controlEvaluator;
    private final SealService sealService;
    private final AttestationService attestationService;
    private final MutationDetector mutationDetector;
    private final SchemaValidator schemaValidator;
    private final VerificationRepository verificationRepository;
    private final ContractTether contractTether;
    private final IntegrityScorer scorer;
    private final CanonicalJson json;
    private final BoundaryDefinitionLoader definitions;
    private final AuditService auditService;
    private final Clock clock;

    public Result<VerificationRecord> verify(String boundaryId) {
        return verify(boundaryId, VerificationKind.COMPREHENSIVE, TRIGGER_MANUAL);
    }

    public Result<VerificationRecord> verify(String boundaryId, VerificationKind kind) {
        return verify(boundaryId, kind, TRIGGER_MANUAL);
    }

    /**
     * Run a verification of the given kind.
     *
     * @param triggeredBy {@code manual} or {@code scheduled}
     * @throws UnpersistedVerificationException if the signed record could not be stored
     */
    public Result<VerificationRecord> verify(String boundaryId, VerificationKind kind, String triggeredBy) {
        VerificationKind effectiveKind = kind != null ? kind : VerificationKind.COMPREHENSIVE;
        if (!RUN_TRIGGERS.contains(triggeredBy)) {
            return Result.failure(ErrorKind.VALIDATION_FAILED, "Unknown trigger: " + safe(triggeredBy));
        }

        contractTether.check(COMPONENT, "verify", verificationRepository.count());

        Optional<Boundary> found = boundaryRegistry.get(boundaryId);
        if (found.isEmpty()) {
            return Result.notFound("Boundary not found: " + safe(boundaryId));
        }
        Boundary boundary = found.get();
        log.info("Verifying boundary {} ({}, {})", boundaryId, effectiveKind, triggeredBy);

        List<ControlEvaluation> controls = List.of();
        List<SealValidation> seals = List.of();
        List<MutationDetection> mutations = List.of();
        List<AttestationVerification> attestations = List.of();
        List<ComplianceCheck> compliance = List.of();

        for (VerificationKind category : effectiveKind.categories()) {
            switch (category) {
                case CONTROL_VERIFICATION -> controls = verifyControls(boundary);
                case SEAL_VALIDATION -> seals = validateSeals(boundary);
                case MUTATION_DETECTION -> mutations = detectMutations(boundary);
                case ATTESTATION_VERIFICATION -> attestations = verifyAttestations(boundary);
                case COMPLIANCE_CHECKING -> compliance = checkCompliance(boundary);
                case COMPREHENSIVE -> throw new IllegalStateException("COMPREHENSIVE is not a single category");
            }
        }

        Findings findings = new Findings(controls, seals,
            effectiveKind.covers(VerificationKind.MUTATION_DETECTION), mutations, attestations, compliance);
        Score score = scorer.score(findings);

        Instant now = clock.instant();
        VerificationRecord unsigned = VerificationRecord.builder()
            .verificationId("verification-" + UUID.randomUUID())
            .boundaryId(boundaryId)
            .timestamp(now)
            .verificationKind(effectiveKind)
            .verifierId(VERIFIER_ID)
            .triggeredBy(triggeredBy)
            .categoriesRun(effectiveKind.categories())
            .controlVerifications(controls)
            .sealValidations(seals)
            .mutationDetections(mutations)
            .attestationVerifications(attestations)
            .complianceChecks(compliance)
            .integrityStatus(score.status())
            .confidence(score.confidence())
            .totalChecks(score.totalChecks())
            .passedChecks(score.passedChecks())
            .criticalFailures(score.criticalFailures())
            .resultDetails("Passed " + score.passedChecks() + " of " + score.totalChecks()
                + " checks, " + score.criticalFailures() + " critical failure(s)")
            .violations(scorer.violations(findings, now))
            .recommendations(scorer.recommendations(findings, score.status()))
            .nextScheduledVerification(now.plus(VERIFICATION_INTERVAL))
            .build();

        return signAndStore(unsigned);
    }

    /**
     * Record an externally discovered incident as a single-violation verification
     * with status {@code compromised} and confidence 1.0.
     */
    public Result<VerificationRecord> reportViolation(String boundaryId, ViolationKind kind, String details,
                                                      Severity severity) {
        if (kind == null) {
            return Result.failure(ErrorKind.VALIDATION_FAILED, "Violation kind is required");
        }

        contractTether.check(COMPONENT, "report_violation", verificationRepository.count());

        if (boundaryRegistry.get(boundaryId).isEmpty()) {
            return Result.notFound("Boundary not found: " + safe(boundaryId));
        }

        Instant now = clock.instant();
        Violation violation = IntegrityScorer.violation(kind, severity != null ? severity : Severity.MEDIUM,
            details, "Manual report", "Investigate reported violation", now);

        VerificationRecord unsigned = VerificationRecord.builder()
            .verificationId("verification-" + UUID.randomUUID())
            .boundaryId(boundaryId)
            .timestamp(now)
            .verificationKind(VerificationKind.COMPREHENSIVE)
            .verifierId("system")
            .triggeredBy(TRIGGER_REPORTED)
            .integrityStatus(IntegrityStatus.COMPROMISED)
            .confidence(1.0)
            .criticalFailures(1)
            .resultDetails("Violation reported: " + details)
            .violation(violation)
            .nextScheduledVerification(now.plus(VERIFICATION_INTERVAL))
            .build();

        log.warn("VIOLATION REPORTED [{}]: kind={} severity={}", boundaryId, kind, violation.getSeverity());
        auditService.record(AuditService.VIOLATION, "REPORTED", boundaryId, null, kind + ": " + details);
        return signAndStore(unsigned);
    }

    public Result<VerificationRecord> getVerification(String verificationId) {
        return verificationRepository.findById(verificationId)
            .map(Result::ok)
            .orElseGet(() -> Result.notFound("Verification not found: " + safe(verificationId)));
    }

    /**
     * Stored verifications, oldest first. Either filter may be {@code null}.
     */
    public List<VerificationRecord> listVerifications(String boundaryId, IntegrityStatus status) {
        return verificationRepository.findAll().stream()
            .filter(record -> boundaryId == null || boundaryId.equals(record.getBoundaryId()))
            .filter(record -> status == null || record.getIntegrityStatus() == status)
            .sorted((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()))
            .toList();
    }

    public List<Violation> getBoundaryViolations(String boundaryId) {
        return listVerifications(boundaryId, null).stream()
            .map(VerificationRecord::getViolations)
            .flatMap(Collection::stream)
            .toList();
    }

    public List<Recommendation> getBoundaryRecommendations(String boundaryId) {
        return listVerifications(boundaryId, null).stream()
            .map(VerificationRecord::getRecommendations)
            .flatMap(Collection::stream)
            .toList();
    }

    /**
     * Re-check the signature of a stored record against its content.
     */
    public Result<Boolean> verifyRecordSignature(String verificationId) {
        return getVerification(verificationId).map(record -> safeVerify(
            json.write(record.unsigned()), record.getSignature()));
    }

    private Result<VerificationRecord> signAndStore(VerificationRecord unsigned) {
        VerificationRecord record = unsigned.toBuilder()
            .signature(sealService.create(json.write(unsigned)))
            .build();

        SchemaValidationResult validation = schemaValidator.validate(record, SchemaValidator.BOUNDARY_INTEGRITY);
        if (!validation.isValid()) {
            log.warn("Verification {} failed {}: {}", record.getVerificationId(),
                SchemaValidator.BOUNDARY_INTEGRITY, validation.getErrors());
            return Result.failure(ErrorKind.VALIDATION_FAILED,
                "Verification record is invalid: " + validation.getErrors());
        }

        try {
            verificationRepository.append(record);
        } catch (PersistenceException e) {
            log.error("Verification {} of {} computed but not stored", record.getVerificationId(),
                record.getBoundaryId(), e);
            throw new UnpersistedVerificationException(record, e);
        }

        if (!record.getViolations().isEmpty()) {
            auditService.record(AuditService.VIOLATION, "DETECTED", record.getBoundaryId(), record.getVerifierId(),
                record.getViolations().size() + " violation(s) in " + record.getVerificationId());
        }
        auditService.record(AuditService.VERIFICATION, record.getIntegrityStatus().name(), record.getBoundaryId(),
            record.getVerifierId(), record.getVerificationId() + " confidence=" + record.getConfidence());
        log.info("Boundary {} is {} (confidence {}, {} violation(s))", record.getBoundaryId(),
            record.getIntegrityStatus(), record.getConfidence(), record.getViolations().size());
        return Result.ok(record);
    }

    private List<ControlEvaluation> verifyControls(Boundary boundary) {
        ControlContext context = ControlContext.forVerification(boundary);
        return boundary.getControls().stream()
            .map(control -> controlEvaluator.evaluate(control, context))
            .toList();
    }

    private List<SealValidation> validateSeals(Boundary boundary) {
        List<SealValidation> validations = new ArrayList<>();
        if (boundary.getSignature() != null) {
            boolean valid = safeVerify(definitions.signedContent(boundary), boundary.getSignature());
            validations.add(SealValidation.builder()
                .sealId(SealValidation.BOUNDARY_SIGNATURE)
                .valid(valid)
                .details(valid ? "Boundary signature matches its content" : "Boundary signature does not match its content")
                .evidence("signature=" + boundary.getSignature())
                .build());
        }
        for (Seal seal : boundary.getSeals()) {
            boolean complete = seal.getData() != null && seal.getSignature() != null;
            boolean valid = complete && safeVerify(seal.getData(), seal.getSignature());
            validations.add(SealValidation.builder()
                .sealId(seal.getSealId())
                .valid(valid)
                .details(!complete ? "Seal is missing data or signature"
                    : valid ? "Seal is valid" : "Seal does not match its data")
                .evidence("signature=" + seal.getSignature())
                .build());
        }
        return validations;
    }

    private List<MutationDetection> detectMutations(Boundary boundary) {
        List<Mutation> detected;
        try {
            detected = mutationDetector.detect(boundary.getBoundaryId(), ENTITY_TYPE, json.toMap(boundary));
        } catch (RuntimeException e) {
            log.warn("Mutation detection failed for {}: {}", boundary.getBoundaryId(), e.toString());
            return List.of(MutationDetection.builder()
                .mutationId("mutation-" + UUID.randomUUID())
                .mutationType("detection_error")
                .detectedAt(clock.instant())
                .severity(Severity.MEDIUM)
                .details("Mutation detection could not run: " + e.getMessage())
                .evidence(e.toString())
                .build());
        }
        if (detected == null) {
            return List.of();
        }

        Instant now = clock.instant();
        return detected.stream()
            .map(mutation -> MutationDetection.builder()
                .mutationId(mutation.getMutationId() != null ? mutation.getMutationId() : "mutation-" + UUID.randomUUID())
                .mutationType(mutation.getMutationType() != null ? mutation.getMutationType() : "unknown")
                .detectedAt(mutation.getDetectedAt() != null ? mutation.getDetectedAt() : now)
                .severity(mutation.getSeverity() != null ? mutation.getSeverity() : Severity.MEDIUM)
                .details(Objects.toString(mutation.getDetails(), ""))
                .evidence(Objects.toString(mutation.getEvidence(), ""))
                .build())
            .toList();
    }

    private List<AttestationVerification> verifyAttestations(Boundary boundary) {
        List<AttestationVerification> verifications = new ArrayList<>();
        for (AttestationReference reference : boundary.getAttestations()) {
            String attestationId = reference.getAttestationId();
            AttestationVerification.AttestationVerificationBuilder result = AttestationVerification.builder()
                .attestationId(attestationId);
            try {
                if (attestationService.get(attestationId).isEmpty()) {
                    result.valid(false).details("not found").evidence("attestation_id=" + attestationId);
                } else if (attestationService.verify(attestationId)) {
                    result.valid(true).details("Attestation is valid").evidence("attestation_id=" + attestationId);
                } else {
                    result.valid(false).details("Attestation verification failed").evidence("attestation_id=" + attestationId);
                }
            } catch (RuntimeException e) {
                log.warn("Attestation {} could not be checked: {}", attestationId, e.toString());
                result.valid(false).details("Attestation check failed: " + e.getMessage()).evidence(e.toString());
            }
            verifications.add(result.build());
        }
        return verifications;
    }

    private List<ComplianceCheck> checkCompliance(Boundary boundary) {
        List<ComplianceCheck> checks = new ArrayList<>();

        SchemaValidationResult schema;
        try {
            schema = schemaValidator.validate(boundary, SchemaValidator.TRUST_BOUNDARY);
        } catch (RuntimeException e) {
            schema = SchemaValidationResult.invalid(List.of("Schema validator failed: " + e.getMessage()));
        }
        checks.add(check("schema-compliance", schema.isValid(),
            schema.isValid() ? "Conforms to " + SchemaValidator.TRUST_BOUNDARY : "Does not conform to " + SchemaValidator.TRUST_BOUNDARY,
            schema.isValid() ? "no errors" : String.join("; ", schema.getErrors())));

        List<String> missing = requiredFields(boundary).entrySet().stream()
            .filter(field -> field.getValue() == null || field.getValue() instanceof String s && s.isBlank())
            .map(Map.Entry::getKey)
            .toList();
        checks.add(check("required-fields", missing.isEmpty(),
            missing.isEmpty() ? "All required fields present" : "Missing required fields",
            missing.isEmpty() ? "complete" : "missing=" + missing));

        checks.add(check("valid-boundary-type", boundary.getBoundaryType() != null,
            boundary.getBoundaryType() != null ? "Valid boundary type" : "Boundary type is missing or unknown",
            "boundary_type=" + boundary.getBoundaryType()));
        checks.add(check("valid-classification", boundary.getClassification() != null,
            boundary.getClassification() != null ? "Valid classification" : "Classification is missing or unknown",
            "classification=" + boundary.getClassification()));
        checks.add(check("valid-status", boundary.getStatus() != null,
            boundary.getStatus() != null ? "Valid status" : "Status is missing or unknown",
            "status=" + boundary.getStatus()));

        boolean versionValid = boundary.getVersion() != null && VERSION_FORMAT.matcher(boundary.getVersion()).matches();
        checks.add(check("valid-version-format", versionValid,
            versionValid ? "Version follows MAJOR.MINOR.PATCH" : "Version does not follow MAJOR.MINOR.PATCH",
            "version=" + boundary.getVersion()));
        return checks;
    }

    private static Map<String, Object> requiredFields(Boundary boundary) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("boundary_id", boundary.getBoundaryId());
        fields.put("name", boundary.getName());
        fields.put("description", boundary.getDescription());
        fields.put("boundary_type", boundary.getBoundaryType());
        fields.put("classification", boundary.getClassification());
        fields.put("created_at", boundary.getCreatedAt());
        fields.put("updated_at", boundary.getUpdatedAt());
        fields.put("version", boundary.getVersion());
        fields.put("status", boundary.getStatus());
        return fields;
    }

    private static ComplianceCheck check(String requirementId, boolean compliant, String details, String evidence) {
        return ComplianceCheck.builder()
            .requirementId(requirementId)
            .compliant(compliant)
            .details(details)
            .evidence(evidence)
            .build();
    }

    private boolean safeVerify(String content, String seal) {
        try {
            return sealService.verify(content, seal);
        } catch (RuntimeException e) {
            log.warn("Seal verification raised an error: {}", e.toString());
            return false;
        }
    }

    private static String safe(String value) {
        return value == null ? "null" : Encode.forJava(value);
    }
}
