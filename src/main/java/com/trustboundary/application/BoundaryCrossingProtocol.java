package com.trustboundary.application;

import com.trustboundary.application.control.ControlContext;
import com.trustboundary.application.control.ControlEvaluator;
import com.trustboundary.domain.model.Attestation;
import com.trustboundary.domain.model.AuditEvent;
import com.trustboundary.domain.model.AuthorizationDecision;
import com.trustboundary.domain.model.AuthorizationDecision.Decision;
import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.Control;
import com.trustboundary.domain.model.ControlEvaluation;
import com.trustboundary.domain.model.CrossingEventType;
import com.trustboundary.domain.model.CrossingRequest;
import com.trustboundary.domain.model.CrossingStatus;
import com.trustboundary.domain.model.ExecutionResult;
import com.trustboundary.domain.model.ImpactAssessment;
import com.trustboundary.domain.model.TrustDecayEvent;
import com.trustboundary.domain.model.TrustDecayReason;
import com.trustboundary.domain.repository.CrossingRepository;
import com.trustboundary.infrastructure.attestation.AttestationService;
import com.trustboundary.infrastructure.audit.AuditService;
import com.trustboundary.infrastructure.registry.BoundaryRegistry;
import com.trustboundary.infrastructure.transport.CrossingExecutor;
import com.trustboundary.infrastructure.trust.TrustDecayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Boundary Crossing Protocol.
 *
 * <p>Owns the lifecycle of crossing requests:
 * <pre>
 * requested -> validating -> validation_failed
 *                         -> validated -> authorization_pending -> denied
 *                                                               -> authorized -> executing -> completed | failed
 * </pre>
 * Every status change is recorded as one audit event on the request, and the
 * request is persisted after every operation. Terminal requests are never
 * touched again apart from attaching attestations.
 *
 * <p>Routine outcomes (unknown request, illegal transition) come back as a
 * {@link Result}. A failed contract tether or a storage failure is thrown; in
 * both cases nothing has been persisted by the failing call.
 *
 * <p>Not safe for concurrent mutation of the same request; callers must keep
 * one writer per request id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BoundaryCrossingProtocol {

    public static final String COMPONENT = "BoundaryCrossingProtocol";

    private static final String SYSTEM_ACTOR = "system";

    private final BoundaryRegistry boundaryRegistry;
    private final ControlEvaluator controlEvaluator;
    private final AttestationService attestationService;
    private final CrossingExecutor crossingExecutor;
    private final TrustDecayService trustDecayService;
    private final CrossingRepository crossingRepository;
    private final ContractTether contractTether;
    private final ImpactAssessor impactAssessor;
    private final TrustDecayPolicy decayPolicy;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Submit a crossing request and validate it against the target boundary's controls.
     *
     * <p>Identity and submission time are assigned when absent. A request whose
     * target boundary does not exist is recorded as {@code failed} with
     * {@code BOUNDARY_NOT_FOUND}. Controls are evaluated in declaration order and
     * the first ineffective one ends validation.
     *
     * @return the stored request, in {@code authorization_pending}, {@code validation_failed}
     *         or {@code failed}
     */
    public Result<CrossingRequest> submit(CrossingRequest draft) {
        if (draft == null) {
            return Result.failure(ErrorKind.VALIDATION_FAILED, "Crossing request is required");
        }
        if (isBlank(draft.getTargetBoundaryId()) || draft.getCrossingKind() == null) {
            return Result.failure(ErrorKind.VALIDATION_FAILED, "Target boundary and crossing kind are required");
        }
        if (draft.getStatus() != CrossingStatus.REQUESTED || !draft.getAuditTrail().isEmpty()) {
            return Result.failure(ErrorKind.INVALID_STATE, "Only new requests can be submitted");
        }

        contractTether.check(COMPONENT, "submit", crossingRepository.count());

        if (draft.getRequestId() != null && crossingRepository.findById(draft.getRequestId()).isPresent()) {
            return Result.failure(ErrorKind.INVALID_STATE,
                "Request " + safe(draft.getRequestId()) + " was already submitted");
        }

        CrossingRequest request = CrossingRequest.builder()
            .requestId(draft.getRequestId() != null ? draft.getRequestId() : "cr_" + UUID.randomUUID())
            .sourceBoundaryId(draft.getSourceBoundaryId())
            .targetBoundaryId(draft.getTargetBoundaryId())
            .crossingKind(draft.getCrossingKind())
            .direction(draft.getDirection())
            .payload(draft.getPayload())
            .requesterId(draft.getRequesterId())
            .submittedAt(draft.getSubmittedAt() != null ? draft.getSubmittedAt() : clock.instant())
            .status(CrossingStatus.REQUESTED)
            .build();

        log.info("Crossing {} received: {} -> {} ({})", request.getRequestId(),
            request.getSourceBoundaryId(), request.getTargetBoundaryId(), request.getCrossingKind());

        request.advance(CrossingStatus.VALIDATING, event(request, CrossingEventType.REQUEST_RECEIVED,
            request.getRequesterId(), details(
                "source_boundary_id", request.getSourceBoundaryId(),
                "target_boundary_id", request.getTargetBoundaryId(),
                "crossing_kind", request.getCrossingKind().name())));

        Optional<Boundary> target = boundaryRegistry.get(request.getTargetBoundaryId());
        if (target.isEmpty()) {
            return Result.ok(failUnknownBoundary(request));
        }

        List<ControlEvaluation> evaluations = new ArrayList<>();
        ControlEvaluation blocking = null;
        ControlContext context = ControlContext.forCrossing(request, target.get());
        for (Control control : target.get().getControls()) {
            ControlEvaluation evaluation = controlEvaluator.evaluate(control, context);
            evaluations.add(evaluation);
            if (evaluation.blocksCrossing()) {
                blocking = evaluation;
                break;
            }
        }
        request.recordControlEvaluations(evaluations);

        if (blocking != null) {
            request.recordFailureReason(blocking.getControlId() + ": " + blocking.getDetail());
            request.advance(CrossingStatus.VALIDATION_FAILED, event(request, CrossingEventType.VALIDATION_FAILED,
                SYSTEM_ACTOR, details(
                    "control_id", blocking.getControlId(),
                    "detail", blocking.getDetail(),
                    "evidence", blocking.getEvidence())));
            crossingRepository.save(request);

            log.warn("CROSSING VALIDATION FAILED [{}]: control={} detail={}",
                request.getRequestId(), blocking.getControlId(), blocking.getDetail());
            auditService.record(AuditService.CROSSING, "VALIDATION_FAILED", request.getRequestId(),
                request.getRequesterId(), request.getFailureReason());
            return Result.ok(request);
        }

        List<String> applied = evaluations.stream().map(ControlEvaluation::getControlId).toList();
        request.recordAppliedControls(applied);
        request.advance(CrossingStatus.VALIDATED, event(request, CrossingEventType.VALIDATED,
            SYSTEM_ACTOR, details("applied_controls", applied)));
        request.advance(CrossingStatus.AUTHORIZATION_PENDING, event(request, CrossingEventType.AUTHORIZATION_PENDING,
            SYSTEM_ACTOR, details()));
        crossingRepository.save(request);

        log.info("Crossing {} validated against {} control(s), awaiting authorization",
            request.getRequestId(), applied.size());
        return Result.ok(request);
    }

    /**
     * Record the authorization decision for a request awaiting it.
     *
     * <p>Authorization is single-assignment: a second call on the same request is
     * rejected. A denial ends the crossing and decays trust in both boundaries.
     * An approval does not execute the crossing.
     */
    public Result<CrossingRequest> authorize(String requestId, String authorizerId, Decision decision, String reason) {
        if (decision == null || isBlank(authorizerId)) {
            return Result.failure(ErrorKind.VALIDATION_FAILED, "Authorizer and decision are required");
        }

        contractTether.check(COMPONENT, "authorize", crossingRepository.count());

        Optional<CrossingRequest> found = crossingRepository.findById(requestId);
        if (found.isEmpty()) {
            return Result.notFound("Crossing request not found: " + safe(requestId));
        }
        CrossingRequest request = found.get();

        if (request.getAuthorization() != null) {
            return Result.failure(ErrorKind.INVALID_STATE,
                "Request " + safe(requestId) + " was already " + request.getAuthorization().getDecision());
        }
        if (request.getStatus() != CrossingStatus.AUTHORIZATION_PENDING) {
            return Result.failure(ErrorKind.INVALID_STATE,
                "Request " + safe(requestId) + " is " + request.getStatus() + ", not awaiting authorization");
        }

        Instant decidedAt = clock.instant();
        request.recordAuthorization(AuthorizationDecision.builder()
            .decision(decision)
            .authorizerId(authorizerId)
            .decidedAt(decidedAt)
            .reason(reason)
            .build());

        if (decision == Decision.DENY) {
            request.recordFailureReason(reason != null ? reason : "denied");
            request.advance(CrossingStatus.DENIED, event(request, CrossingEventType.DENIED,
                authorizerId, details("reason", reason)));
            crossingRepository.save(request);

            log.warn("CROSSING DENIED [{}]: authorizer={} reason={}", requestId, authorizerId, reason);
            auditService.record(AuditService.CROSSING, "DENIED", requestId, authorizerId, reason);
            decayBoundaries(request, TrustDecayReason.DENIED);
            return Result.ok(request);
        }

        request.advance(CrossingStatus.AUTHORIZED, event(request, CrossingEventType.AUTHORIZED,
            authorizerId, details("reason", reason)));
        crossingRepository.save(request);

        log.info("Crossing {} authorized by {}", requestId, authorizerId);
        auditService.record(AuditService.CROSSING, "AUTHORIZED", requestId, authorizerId, reason);
        return Result.ok(request);
    }

    /**
     * Perform an authorized crossing and assess its impact.
     *
     * <p>Executor failures, thrown or returned, end the crossing as {@code failed}
     * and decay trust in both boundaries. Executing a request that was never
     * authorized is rejected as {@code UNAUTHORIZED} and decays the requester.
     */
    public Result<CrossingRequest> execute(String requestId) {
        contractTether.check(COMPONENT, "execute", crossingRepository.count());

        Optional<CrossingRequest> found = crossingRepository.findById(requestId);
        if (found.isEmpty()) {
            return Result.notFound("Crossing request not found: " + safe(requestId));
        }
        CrossingRequest request = found.get();

        if (request.getStatus() == CrossingStatus.AUTHORIZATION_PENDING) {
            log.warn("UNAUTHORIZED EXECUTION [{}]: requester={}", requestId, request.getRequesterId());
            auditService.record(AuditService.CROSSING, "REJECTED", requestId, request.getRequesterId(),
                "execute before authorization");
            if (!isBlank(request.getRequesterId())) {
                emitDecay(request.getRequesterId(), TrustDecayReason.UNAUTHORIZED, requestId);
            }
            return Result.failure(ErrorKind.UNAUTHORIZED, "Request " + safe(requestId) + " has not been authorized");
        }
        if (request.getStatus() != CrossingStatus.AUTHORIZED) {
            return Result.failure(ErrorKind.INVALID_STATE,
                "Request " + safe(requestId) + " is " + request.getStatus() + ", not authorized");
        }

        request.advance(CrossingStatus.EXECUTING, event(request, CrossingEventType.EXECUTING,
            SYSTEM_ACTOR, details()));

        ExecutionResult result = perform(request);
        request.recordExecution(result);

        ImpactAssessment impact = impactAssessor.assess(request, result);
        request.recordImpact(impact);
        request.note(event(request, CrossingEventType.IMPACT_ASSESSED, SYSTEM_ACTOR, details(
            "trust_impact", impact.getTrustImpact(),
            "security_impact", impact.getSecurityImpact().name(),
            "governance_impact", impact.getGovernanceImpact().name(),
            "performance_impact", impact.getPerformanceImpact().name())));

        if (result.isSuccess()) {
            request.advance(CrossingStatus.COMPLETED, event(request, CrossingEventType.COMPLETED,
                SYSTEM_ACTOR, details()));
            crossingRepository.save(request);
            log.info("Crossing {} completed (trust impact {})", requestId, impact.getTrustImpact());
            return Result.ok(request);
        }

        request.recordFailureReason(result.getErrorCode() + ": " + result.getErrorMessage());
        request.advance(CrossingStatus.FAILED, event(request, CrossingEventType.FAILED, SYSTEM_ACTOR, details(
            "error_code", result.getErrorCode(),
            "error_message", result.getErrorMessage())));
        crossingRepository.save(request);

        log.warn("CROSSING FAILED [{}]: {} {}", requestId, result.getErrorCode(), result.getErrorMessage());
        auditService.record(AuditService.CROSSING, "FAILED", requestId, request.getRequesterId(),
            result.getErrorCode());
        decayBoundaries(request, TrustDecayReason.FAILED);
        return Result.ok(request);
    }

    /**
     * Issue an attestation about a request and attach it. The crossing status is not changed.
     */
    public Result<Attestation> attest(String requestId, String attesterId, Map<String, Object> claims) {
        if (isBlank(attesterId)) {
            return Result.failure(ErrorKind.VALIDATION_FAILED, "Attester is required");
        }

        contractTether.check(COMPONENT, "attest", crossingRepository.count());

        Optional<CrossingRequest> found = crossingRepository.findById(requestId);
        if (found.isEmpty()) {
            return Result.notFound("Crossing request not found: " + safe(requestId));
        }
        CrossingRequest request = found.get();

        Attestation attestation = attestationService.issue(requestId, attesterId, claims);
        request.attachAttestation(attestation.getAttestationId());
        crossingRepository.save(request);

        log.info("Attestation {} attached to crossing {} by {}", attestation.getAttestationId(), requestId, attesterId);
        return Result.ok(attestation);
    }

    public Result<CrossingRequest> get(String requestId) {
        return crossingRepository.findById(requestId)
            .map(Result::ok)
            .orElseGet(() -> Result.notFound("Crossing request not found: " + safe(requestId)));
    }

    /**
     * Requests touching {@code boundaryId} (as source or target) in {@code status}.
     * Either filter may be {@code null}.
     */
    public List<CrossingRequest> list(String boundaryId, CrossingStatus status) {
        return crossingRepository.findAll().stream()
            .filter(request -> boundaryId == null || request.involves(boundaryId))
            .filter(request -> status == null || request.getStatus() == status)
            .toList();
    }

    public Result<List<AuditEvent>> getAuditTrail(String requestId) {
        return get(requestId).map(CrossingRequest::getAuditTrail);
    }

    private CrossingRequest failUnknownBoundary(CrossingRequest request) {
        ExecutionResult notFound = ExecutionResult.failed(ExecutionResult.BOUNDARY_NOT_FOUND,
            "Target boundary not found: " + request.getTargetBoundaryId());
        request.recordExecution(notFound);
        request.recordFailureReason(notFound.getErrorMessage());
        request.advance(CrossingStatus.FAILED, event(request, CrossingEventType.FAILED, SYSTEM_ACTOR, details(
            "error_code", notFound.getErrorCode(),
            "error_message", notFound.getErrorMessage())));
        crossingRepository.save(request);

        log.warn("CROSSING FAILED [{}]: target boundary {} not found",
            request.getRequestId(), request.getTargetBoundaryId());
        auditService.record(AuditService.CROSSING, "FAILED", request.getRequestId(), request.getRequesterId(),
            ExecutionResult.BOUNDARY_NOT_FOUND);
        return request;
    }

    private ExecutionResult perform(CrossingRequest request) {
        Optional<Boundary> target = boundaryRegistry.get(request.getTargetBoundaryId());
        if (target.isEmpty()) {
            return ExecutionResult.failed(ExecutionResult.BOUNDARY_NOT_FOUND,
                "Target boundary no longer exists: " + request.getTargetBoundaryId());
        }
        try {
            ExecutionResult result = crossingExecutor.execute(request, target.get());
            return result != null
                ? result
                : ExecutionResult.failed(ExecutionResult.EXECUTION_ERROR, "Executor returned no result");
        } catch (RuntimeException e) {
            log.error("Crossing {} execution raised an error", request.getRequestId(), e);
            return ExecutionResult.failed(ExecutionResult.EXECUTION_ERROR, e.getMessage());
        }
    }

    private void decayBoundaries(CrossingRequest request, TrustDecayReason reason) {
        for (String boundaryId : new String[] {request.getSourceBoundaryId(), request.getTargetBoundaryId()}) {
            if (!isBlank(boundaryId)) {
                emitDecay(boundaryId, reason, request.getRequestId());
            }
        }
    }

    // The crossing is already stored; a decay sink failure must not undo it
    private void emitDecay(String entityId, TrustDecayReason reason, String requestId) {
        TrustDecayEvent event = TrustDecayEvent.builder()
            .eventId("td_" + UUID.randomUUID())
            .entityId(entityId)
            .reason(reason)
            .magnitude(decayPolicy.magnitudeFor(reason))
            .requestId(requestId)
            .occurredAt(clock.instant())
            .build();
        try {
            trustDecayService.recordDecay(event);
        } catch (RuntimeException e) {
            log.error("Trust decay {} for {} was not recorded", reason, entityId, e);
        }
    }

    private AuditEvent event(CrossingRequest request, CrossingEventType type, String actorId,
                             Map<String, Object> details) {
        Instant now = clock.instant();
        Instant timestamp = request.lastEvent()
            .map(AuditEvent::getTimestamp)
            .filter(last -> last.isAfter(now))
            .orElse(now);
        return AuditEvent.builder()
            .eventId("evt_" + UUID.randomUUID())
            .timestamp(timestamp)
            .eventType(type)
            .actorId(actorId)
            .details(details)
            .build();
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return details;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String safe(String value) {
        return value == null ? "null" : Encode.forJava(value);
    }
}
