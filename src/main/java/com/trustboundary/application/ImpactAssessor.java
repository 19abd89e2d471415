package com.trustboundary.application;

import com.trustboundary.domain.model.Classification;
import com.trustboundary.domain.model.CrossingKind;
import com.trustboundary.domain.model.CrossingRequest;
import com.trustboundary.domain.model.ExecutionResult;
import com.trustboundary.domain.model.ImpactAssessment;
import com.trustboundary.domain.model.ImpactLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.time.Clock;
import java.util.Locale;

/**
 * Derives the impact of an executed crossing from its kind, the payload's
 * classification tag and the execution outcome.
 *
 * <p>Classification sets the baseline (an untagged payload counts as public,
 * an unrecognized tag as internal).
 * A control transfer is always high security and governance impact. A failed
 * execution costs the failure decay on top.
 */
@Slf4j
@RequiredArgsConstructor
public class ImpactAssessor {

    static final int LARGE_PAYLOAD_ENTRIES = 64;
    static final String CLASSIFICATION_KEY = "classification";

    private static final double CONTROL_TRANSFER_TRUST_CEILING = -0.05;

    private final TrustDecayPolicy decayPolicy;
    private final Clock clock;

    public ImpactAssessment assess(CrossingRequest request, ExecutionResult execution) {
        Classification classification = classificationOf(request);

        double trust = baselineTrust(classification);
        ImpactLevel security = baselineSecurity(classification);
        ImpactLevel governance = baselineGovernance(classification);

        boolean controlTransfer = request.getCrossingKind() == CrossingKind.CONTROL_TRANSFER;
        if (controlTransfer) {
            security = ImpactLevel.HIGH;
            governance = ImpactLevel.HIGH;
            trust = Math.min(trust, CONTROL_TRANSFER_TRUST_CEILING);
        }

        boolean succeeded = execution != null && execution.isSuccess();
        if (!succeeded) {
            trust -= decayPolicy.getFailed();
        }

        ImpactLevel performance = baselinePerformance(request.getCrossingKind());
        if (request.getPayload().size() > LARGE_PAYLOAD_ENTRIES) {
            performance = performance.raise();
        }

        return ImpactAssessment.builder()
            .trustImpact(round(trust))
            .securityImpact(security)
            .governanceImpact(governance)
            .performanceImpact(performance)
            .rationale("classification=" + classification.name().toLowerCase(Locale.ROOT)
                + ", kind=" + (request.getCrossingKind() == null ? "unknown" : request.getCrossingKind().name().toLowerCase(Locale.ROOT))
                + ", outcome=" + (succeeded ? "success" : "failure"))
            .assessedAt(clock.instant())
            .build();
    }

    private static Classification classificationOf(CrossingRequest request) {
        Object tag = request.getPayload().get(CLASSIFICATION_KEY);
        if (tag == null) {
            return Classification.PUBLIC;
        }
        return request.payloadClassification().orElseGet(() -> {
            log.warn("Crossing {} carries unrecognized classification '{}', assessed as internal",
                request.getRequestId(), Encode.forJava(tag.toString()));
            return Classification.INTERNAL;
        });
    }

    private static double baselineTrust(Classification classification) {
        return switch (classification) {
            case CRITICAL -> -0.1;
            case RESTRICTED -> -0.05;
            case CONFIDENTIAL -> -0.02;
            case INTERNAL -> 0.0;
            case PUBLIC -> 0.01;
        };
    }

    private static ImpactLevel baselineSecurity(Classification classification) {
        return switch (classification) {
            case CRITICAL -> ImpactLevel.HIGH;
            case RESTRICTED -> ImpactLevel.MEDIUM;
            case CONFIDENTIAL -> ImpactLevel.LOW;
            case INTERNAL, PUBLIC -> ImpactLevel.NONE;
        };
    }

    private static ImpactLevel baselineGovernance(Classification classification) {
        return switch (classification) {
            case CRITICAL -> ImpactLevel.HIGH;
            case RESTRICTED -> ImpactLevel.MEDIUM;
            case CONFIDENTIAL, INTERNAL -> ImpactLevel.LOW;
            case PUBLIC -> ImpactLevel.NONE;
        };
    }

    private static ImpactLevel baselinePerformance(CrossingKind kind) {
        if (kind == null) {
            return ImpactLevel.NONE;
        }
        return switch (kind) {
            case DATA_TRANSFER -> ImpactLevel.LOW;
            case CONTROL_TRANSFER -> ImpactLevel.MEDIUM;
            case AUTHENTICATION, AUTHORIZATION, API_CALL, DATA_ACCESS -> ImpactLevel.NONE;
        };
    }

    // Keeps -0.1 - 0.02 at -0.12 instead of -0.12000000000000001
    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
