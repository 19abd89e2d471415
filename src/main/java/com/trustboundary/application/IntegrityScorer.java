package com.trustboundary.application;

import com.trustboundary.domain.model.AttestationVerification;
import com.trustboundary.domain.model.ComplianceCheck;
import com.trustboundary.domain.model.ControlEvaluation;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns the raw check results of a verification run into a score, violations
 * and recommendations.
 *
 * <p>Scoring rules:
 * <ul>
 *   <li>every control, seal, attestation and compliance check is one check</li>
 *   <li>mutation detection, when run, is one check that passes iff nothing changed</li>
 *   <li>ineffective controls, invalid seals, invalid attestations and failed compliance
 *       checks are critical failures; any high or critical mutation adds one more</li>
 *   <li>any critical failure means {@code compromised}; otherwise confidence
 *       decides: 0.9 and up {@code intact}, 0.7 and up {@code warning}, else {@code unknown}</li>
 * </ul>
 */
public class IntegrityScorer {

    static final double INTACT_THRESHOLD = 0.9;
    static final double WARNING_THRESHOLD = 0.7;

    /**
     * Check results gathered by one run. {@code mutationDetectionRun} distinguishes
     * "detection found nothing" from "detection was not part of this run".
     */
    public record Findings(
            List<ControlEvaluation> controls,
            List<SealValidation> seals,
            boolean mutationDetectionRun,
            List<MutationDetection> mutations,
            List<AttestationVerification> attestations,
            List<ComplianceCheck> compliance) {
    }

    public record Score(int totalChecks, int passedChecks, int criticalFailures,
                        double confidence, IntegrityStatus status) {
    }

    public Score score(Findings findings) {
        int total = 0;
        int passed = 0;
        int critical = 0;

        for (ControlEvaluation control : findings.controls()) {
            total++;
            if (control.getStatus() == ControlStatus.EFFECTIVE) {
                passed++;
            } else if (control.getStatus() == ControlStatus.INEFFECTIVE) {
                critical++;
            }
        }
        for (SealValidation seal : findings.seals()) {
            total++;
            if (seal.isValid()) {
                passed++;
            } else {
                critical++;
            }
        }
        if (findings.mutationDetectionRun()) {
            total++;
            if (findings.mutations().isEmpty()) {
                passed++;
            }
            if (findings.mutations().stream()
                    .anyMatch(mutation -> mutation.getSeverity() != null && mutation.getSeverity().atLeastHigh())) {
                critical++;
            }
        }
        for (AttestationVerification attestation : findings.attestations()) {
            total++;
            if (attestation.isValid()) {
                passed++;
            } else {
                critical++;
            }
        }
        for (ComplianceCheck check : findings.compliance()) {
            total++;
            if (check.isCompliant()) {
                passed++;
            } else {
                critical++;
            }
        }

        double confidence = total == 0 ? 0.0 : (double) passed / total;
        return new Score(total, passed, critical, confidence, statusOf(critical, confidence));
    }

    static IntegrityStatus statusOf(int criticalFailures, double confidence) {
        if (criticalFailures > 0) {
            return IntegrityStatus.COMPROMISED;
        }
        if (confidence >= INTACT_THRESHOLD) {
            return IntegrityStatus.INTACT;
        }
        if (confidence >= WARNING_THRESHOLD) {
            return IntegrityStatus.WARNING;
        }
        return IntegrityStatus.UNKNOWN;
    }

    /**
     * One violation per failed check, in category order.
     */
    public List<Violation> violations(Findings findings, Instant detectedAt) {
        List<Violation> violations = new ArrayList<>();

        findings.controls().stream()
            .filter(control -> control.getStatus() == ControlStatus.INEFFECTIVE)
            .forEach(control -> violations.add(violation(ViolationKind.CONTROL_BYPASS, Severity.HIGH,
                "Control " + control.getControlId() + " is ineffective: " + control.getDetail(),
                control.getEvidence(), "Restore or replace control " + control.getControlId(), detectedAt)));

        findings.seals().stream()
            .filter(seal -> !seal.isValid())
            .forEach(seal -> violations.add(violation(ViolationKind.SEAL_BROKEN, Severity.CRITICAL,
                "Seal " + seal.getSealId() + " is invalid: " + seal.getDetails(),
                seal.getEvidence(), "Investigate the change and reseal the boundary", detectedAt)));

        findings.mutations().forEach(mutation -> violations.add(violation(ViolationKind.UNAUTHORIZED_MUTATION,
            mutation.getSeverity(),
            "Unauthorized " + mutation.getMutationType() + ": " + mutation.getDetails(),
            mutation.getEvidence(), "Review the change and revert it or accept it as the new baseline",
            detectedAt)));

        findings.attestations().stream()
            .filter(attestation -> !attestation.isValid())
            .forEach(attestation -> violations.add(violation(ViolationKind.INVALID_ATTESTATION, Severity.HIGH,
                "Attestation " + attestation.getAttestationId() + " is invalid: " + attestation.getDetails(),
                attestation.getEvidence(), "Obtain a fresh attestation", detectedAt)));

        findings.compliance().stream()
            .filter(check -> !check.isCompliant())
            .forEach(check -> violations.add(violation(ViolationKind.COMPLIANCE_FAILURE, Severity.MEDIUM,
                "Requirement " + check.getRequirementId() + " not met: " + check.getDetails(),
                check.getEvidence(), "Correct the boundary definition", detectedAt)));

        return violations;
    }

    /**
     * Remediation advice for each failure and degraded control, plus one overall
     * recommendation when the boundary is compromised or in warning.
     */
    public List<Recommendation> recommendations(Findings findings, IntegrityStatus status) {
        List<Recommendation> recommendations = new ArrayList<>();

        for (ControlEvaluation control : findings.controls()) {
            if (control.getStatus() == ControlStatus.INEFFECTIVE) {
                recommendations.add(recommendation(RecommendationKind.CONTROL_ENHANCEMENT, Priority.HIGH,
                    "Enhance control " + control.getControlId() + ": " + control.getDetail(),
                    "Review control configuration", "Update control implementation", "Verify effectiveness"));
            } else if (control.getStatus() == ControlStatus.DEGRADED) {
                recommendations.add(recommendation(RecommendationKind.CONTROL_ENHANCEMENT, Priority.MEDIUM,
                    "Improve degraded control " + control.getControlId() + ": " + control.getDetail(),
                    "Identify degradation cause", "Restore control effectiveness", "Verify improvement"));
            }
        }
        findings.seals().stream().filter(seal -> !seal.isValid()).forEach(seal ->
            recommendations.add(recommendation(RecommendationKind.SEAL_RENEWAL, Priority.CRITICAL,
                "Renew invalid seal " + seal.getSealId() + ": " + seal.getDetails(),
                "Investigate seal invalidation cause", "Recreate seal with current state", "Verify new seal")));
        findings.mutations().forEach(mutation ->
            recommendations.add(recommendation(RecommendationKind.MUTATION_INVESTIGATION,
                Priority.of(mutation.getSeverity()),
                "Investigate " + mutation.getMutationType() + " " + mutation.getMutationId(),
                "Identify who made the change", "Revert or approve the change", "Re-baseline the boundary")));
        findings.attestations().stream().filter(attestation -> !attestation.isValid()).forEach(attestation ->
            recommendations.add(recommendation(RecommendationKind.ATTESTATION_UPDATE, Priority.HIGH,
                "Update invalid attestation " + attestation.getAttestationId() + ": " + attestation.getDetails(),
                "Investigate attestation invalidation cause", "Create new attestation", "Verify new attestation")));
        findings.compliance().stream().filter(check -> !check.isCompliant()).forEach(check ->
            recommendations.add(recommendation(RecommendationKind.COMPLIANCE_IMPROVEMENT, Priority.MEDIUM,
                "Address compliance issue " + check.getRequirementId() + ": " + check.getDetails(),
                "Review compliance requirement", "Implement necessary changes", "Verify compliance")));

        if (status == IntegrityStatus.COMPROMISED) {
            recommendations.add(recommendation(RecommendationKind.BOUNDARY_REDEFINITION, Priority.CRITICAL,
                "Redefine compromised boundary",
                "Investigate compromise cause", "Recreate boundary with proper controls", "Verify integrity"));
        } else if (status == IntegrityStatus.WARNING) {
            recommendations.add(recommendation(RecommendationKind.MONITORING_ENHANCEMENT, Priority.HIGH,
                "Enhance boundary monitoring",
                "Increase monitoring frequency", "Add additional monitoring controls",
                "Verify monitoring effectiveness"));
        }
        return recommendations;
    }

    static Violation violation(ViolationKind kind, Severity severity, String details, String evidence,
                               String remediation, Instant detectedAt) {
        return Violation.builder()
            .violationId("violation-" + UUID.randomUUID())
            .kind(kind)
            .severity(severity != null ? severity : Severity.MEDIUM)
            .details(details)
            .evidence(evidence)
            .remediation(remediation)
            .detectedAt(detectedAt)
            .build();
    }

    private static Recommendation recommendation(RecommendationKind kind, Priority priority, String description,
                                                 String... steps) {
        return Recommendation.builder()
            .recommendationId("recommendation-" + UUID.randomUUID())
            .kind(kind)
            .priority(priority)
            .description(description)
            .steps(List.of(steps))
            .build();
    }
}
