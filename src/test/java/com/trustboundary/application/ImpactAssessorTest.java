package com.trustboundary.application;

import com.trustboundary.domain.model.CrossingKind;
import com.trustboundary.domain.model.CrossingRequest;
import com.trustboundary.domain.model.ExecutionResult;
import com.trustboundary.domain.model.ImpactAssessment;
import com.trustboundary.domain.model.ImpactLevel;
import com.trustboundary.support.Boundaries;
import com.trustboundary.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImpactAssessorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final ImpactAssessor assessor = new ImpactAssessor(TrustDecayPolicy.defaults(), clock);

    private static final ExecutionResult OK = ExecutionResult.succeeded(Map.of("delivered", true));

    private static CrossingRequest tagged(String classification, CrossingKind kind) {
        return Boundaries.draft("b1", "b2")
            .crossingKind(kind)
            .payload(Map.of("classification", classification))
            .build();
    }

    @Test
    void criticalPayloadIsHighImpact() {
        ImpactAssessment impact = assessor.assess(tagged("critical", CrossingKind.DATA_TRANSFER), OK);

        assertEquals(-0.1, impact.getTrustImpact(), 1e-9);
        assertEquals(ImpactLevel.HIGH, impact.getSecurityImpact());
        assertEquals(ImpactLevel.HIGH, impact.getGovernanceImpact());
        assertEquals(ImpactLevel.LOW, impact.getPerformanceImpact());
        assertEquals(clock.instant(), impact.getAssessedAt());
    }

    @Test
    void untaggedPayloadCountsAsPublic() {
        ImpactAssessment impact = assessor.assess(Boundaries.draft("b1", "b2").build(), OK);

        assertEquals(0.01, impact.getTrustImpact(), 1e-9);
        assertEquals(ImpactLevel.NONE, impact.getSecurityImpact());
        assertEquals(ImpactLevel.NONE, impact.getGovernanceImpact());
    }

    @Test
    void unrecognizedTagNeverRaisesTrust() {
        ImpactAssessment impact = assessor.assess(tagged("secret", CrossingKind.DATA_TRANSFER), OK);

        assertEquals(0.0, impact.getTrustImpact(), 1e-9);
        assertTrue(impact.getRationale().startsWith("classification=internal"), impact.getRationale());
    }

    @Test
    void controlTransferIsAlwaysHighImpact() {
        ImpactAssessment impact = assessor.assess(tagged("public", CrossingKind.CONTROL_TRANSFER), OK);

        assertEquals(-0.05, impact.getTrustImpact(), 1e-9);
        assertEquals(ImpactLevel.HIGH, impact.getSecurityImpact());
        assertEquals(ImpactLevel.HIGH, impact.getGovernanceImpact());
        assertEquals(ImpactLevel.MEDIUM, impact.getPerformanceImpact());
    }

    @Test
    void failureCostsFailureDecay() {
        ImpactAssessment impact = assessor.assess(tagged("critical", CrossingKind.DATA_TRANSFER),
            ExecutionResult.failed(ExecutionResult.EXECUTION_ERROR, "link down"));

        assertEquals(-0.12, impact.getTrustImpact(), 0.0);
    }

    @Test
    void largePayloadRaisesPerformanceImpact() {
        Map<String, Object> payload = new HashMap<>();
        for (int i = 0; i <= ImpactAssessor.LARGE_PAYLOAD_ENTRIES; i++) {
            payload.put("field-" + i, i);
        }

        ImpactAssessment impact = assessor.assess(Boundaries.draft("b1", "b2").payload(payload).build(), OK);

        assertEquals(ImpactLevel.MEDIUM, impact.getPerformanceImpact());
    }
}
