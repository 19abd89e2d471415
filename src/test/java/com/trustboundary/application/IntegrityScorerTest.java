package com.trustboundary.application;

import com.trustboundary.application.IntegrityScorer.Findings;
import com.trustboundary.application.IntegrityScorer.Score;
import com.trustboundary.domain.model.AttestationVerification;
import com.trustboundary.domain.model.ComplianceCheck;
import com.trustboundary.domain.model.ControlEvaluation;
import com.trustboundary.domain.model.ControlKind;
import com.trustboundary.domain.model.ControlStatus;
import com.trustboundary.domain.model.IntegrityStatus;
import com.trustboundary.domain.model.MutationDetection;
import com.trustboundary.domain.model.Priority;
import com.trustboundary.domain.model.Recommendation;
import com.trustboundary.domain.model.RecommendationKind;
import com.trustboundary.domain.model.SealValidation;
import com.trustboundary.domain.model.Severity;
import com.trustboundary.domain.model.Violation;
import com.trustboundary.domain.model.ViolationKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntegrityScorerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final IntegrityScorer scorer = new IntegrityScorer();

    private static ControlEvaluation control(String id, ControlStatus status) {
        return ControlEvaluation.builder().controlId(id).controlType(ControlKind.MONITORING)
            .status(status).detail(status.name()).build();
    }

    private static ComplianceCheck compliance(String id, boolean compliant) {
        return ComplianceCheck.builder().requirementId(id).compliant(compliant).details("checked").build();
    }

    private static Findings controlsOnly(ControlEvaluation... controls) {
        return new Findings(List.of(controls), List.of(), false, List.of(), List.of(), List.of());
    }

    @Test
    void allPassingChecksAreIntact() {
        Score score = scorer.score(new Findings(
            List.of(control("c1", ControlStatus.EFFECTIVE)),
            List.of(SealValidation.builder().sealId("s1").valid(true).build()),
            true, List.of(),
            List.of(AttestationVerification.builder().attestationId("a1").valid(true).build()),
            List.of(compliance("r1", true))));

        assertEquals(5, score.totalChecks());
        assertEquals(5, score.passedChecks());
        assertEquals(0, score.criticalFailures());
        assertEquals(1.0, score.confidence(), 1e-9);
        assertEquals(IntegrityStatus.INTACT, score.status());
    }

    @Test
    void degradedControlsLowerConfidenceWithoutCompromise() {
        Findings findings = controlsOnly(
            control("c1", ControlStatus.EFFECTIVE), control("c2", ControlStatus.EFFECTIVE),
            control("c3", ControlStatus.EFFECTIVE), control("c4", ControlStatus.DEGRADED));

        Score score = scorer.score(findings);

        assertEquals(0.75, score.confidence(), 1e-9);
        assertEquals(IntegrityStatus.WARNING, score.status());
        List<Recommendation> recommendations = scorer.recommendations(findings, score.status());
        assertEquals(2, recommendations.size());
        assertEquals(Priority.MEDIUM, recommendations.get(0).getPriority());
        assertEquals(RecommendationKind.MONITORING_ENHANCEMENT, recommendations.get(1).getKind());
    }

    @Test
    void lowConfidenceWithoutFailuresIsUnknown() {
        Score score = scorer.score(controlsOnly(
            control("c1", ControlStatus.WARNING), control("c2", ControlStatus.EFFECTIVE)));

        assertEquals(IntegrityStatus.UNKNOWN, score.status());
    }

    @Test
    void emptyRunHasZeroConfidence() {
        Score score = scorer.score(controlsOnly());

        assertEquals(0, score.totalChecks());
        assertEquals(0.0, score.confidence(), 0.0);
        assertEquals(IntegrityStatus.UNKNOWN, score.status());
    }

    @Test
    void brokenSealCompromisesBoundary() {
        Findings findings = new Findings(List.of(),
            List.of(SealValidation.builder().sealId(SealValidation.BOUNDARY_SIGNATURE).valid(false)
                .details("mismatch").build()),
            false, List.of(), List.of(), List.of());

        Score score = scorer.score(findings);
        List<Violation> violations = scorer.violations(findings, NOW);

        assertEquals(IntegrityStatus.COMPROMISED, score.status());
        assertEquals(0.0, score.confidence(), 0.0);
        assertEquals(1, violations.size());
        assertEquals(ViolationKind.SEAL_BROKEN, violations.get(0).getKind());
        assertEquals(Severity.CRITICAL, violations.get(0).getSeverity());
        assertEquals(NOW, violations.get(0).getDetectedAt());
    }

    @Test
    void onlyHighMutationsAreCritical() {
        MutationDetection low = MutationDetection.builder().mutationId("m1").mutationType("field_modified")
            .severity(Severity.LOW).build();
        MutationDetection high = MutationDetection.builder().mutationId("m2").mutationType("field_modified")
            .severity(Severity.HIGH).build();

        Score lowOnly = scorer.score(new Findings(List.of(), List.of(), true, List.of(low), List.of(), List.of()));
        Score both = scorer.score(new Findings(List.of(), List.of(), true, List.of(low, high), List.of(), List.of()));

        assertEquals(1, lowOnly.totalChecks());
        assertEquals(0, lowOnly.criticalFailures());
        assertEquals(IntegrityStatus.UNKNOWN, lowOnly.status());
        assertEquals(1, both.criticalFailures());
        assertEquals(IntegrityStatus.COMPROMISED, both.status());
    }

    @Test
    void severalHighMutationsCountAsOneCriticalFailure() {
        MutationDetection high = MutationDetection.builder().mutationId("m1").mutationType("field_modified")
            .severity(Severity.HIGH).build();
        MutationDetection critical = MutationDetection.builder().mutationId("m2").mutationType("field_removed")
            .severity(Severity.CRITICAL).build();
        Findings findings = new Findings(List.of(), List.of(), true, List.of(high, critical), List.of(), List.of());

        Score score = scorer.score(findings);

        assertEquals(1, score.totalChecks());
        assertEquals(1, score.criticalFailures());
        assertEquals(IntegrityStatus.COMPROMISED, score.status());
        assertEquals(2, scorer.violations(findings, NOW).size());
    }

    @Test
    void everyFailureYieldsOneViolationAndRecommendation() {
        Findings findings = new Findings(
            List.of(control("c1", ControlStatus.INEFFECTIVE)),
            List.of(SealValidation.builder().sealId("s1").valid(false).build()),
            true,
            List.of(MutationDetection.builder().mutationId("m1").mutationType("field_removed")
                .severity(Severity.CRITICAL).build()),
            List.of(AttestationVerification.builder().attestationId("a1").valid(false).details("not found").build()),
            List.of(compliance("r1", false), compliance("r2", true)));

        Score score = scorer.score(findings);
        List<Violation> violations = scorer.violations(findings, NOW);
        List<Recommendation> recommendations = scorer.recommendations(findings, score.status());

        assertEquals(5, score.criticalFailures());
        assertEquals(List.of(ViolationKind.CONTROL_BYPASS, ViolationKind.SEAL_BROKEN,
            ViolationKind.UNAUTHORIZED_MUTATION, ViolationKind.INVALID_ATTESTATION, ViolationKind.COMPLIANCE_FAILURE),
            violations.stream().map(Violation::getKind).toList());
        assertEquals(List.of(Severity.HIGH, Severity.CRITICAL, Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM),
            violations.stream().map(Violation::getSeverity).toList());
        assertEquals(List.of(RecommendationKind.CONTROL_ENHANCEMENT, RecommendationKind.SEAL_RENEWAL,
            RecommendationKind.MUTATION_INVESTIGATION, RecommendationKind.ATTESTATION_UPDATE,
            RecommendationKind.COMPLIANCE_IMPROVEMENT, RecommendationKind.BOUNDARY_REDEFINITION),
            recommendations.stream().map(Recommendation::getKind).toList());
        assertTrue(violations.stream().allMatch(v -> v.getViolationId().startsWith("violation-")));
    }
}
