package com.trustboundary.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Crossing Request aggregate root.
 *
 * <p>Represents one attempt to move data or control across a boundary, together
 * with everything that happened to it. Requests are historical records: they
 * are created on submission and never deleted.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Status only moves forward, following {@link CrossingStatus#canTransitionTo}</li>
 *   <li>Every status change appends exactly one audit event of the matching type</li>
 *   <li>Audit event timestamps are non-decreasing</li>
 *   <li>The authorization decision is assigned at most once</li>
 *   <li>Nothing but the lifecycle's own events is appended after a terminal status</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrossingRequest {

    private final String requestId;
    private final String sourceBoundaryId;
    private final String targetBoundaryId;
    private final CrossingKind crossingKind;
    private final Direction direction;
    private final Map<String, Object> payload;
    private final String requesterId;
    private final Instant submittedAt;

    private CrossingStatus status;
    private final List<AuditEvent> auditTrail;
    private final List<ControlEvaluation> controlEvaluations;
    private final List<String> appliedControls;
    private String failureReason;
    private AuthorizationDecision authorization;
    private ExecutionResult executionResult;
    private ImpactAssessment impact;
    private final List<String> attestationIds;

    @Builder(toBuilder = true)
    @Jacksonized
    CrossingRequest(
            String requestId,
            String sourceBoundaryId,
            String targetBoundaryId,
            CrossingKind crossingKind,
            Direction direction,
            Map<String, Object> payload,
            String requesterId,
            Instant submittedAt,
            CrossingStatus status,
            List<AuditEvent> auditTrail,
            List<ControlEvaluation> controlEvaluations,
            List<String> appliedControls,
            String failureReason,
            AuthorizationDecision authorization,
            ExecutionResult executionResult,
            ImpactAssessment impact,
            List<String> attestationIds) {

        this.requestId = requestId;
        this.sourceBoundaryId = sourceBoundaryId;
        this.targetBoundaryId = targetBoundaryId;
        this.crossingKind = crossingKind;
        this.direction = direction;
        this.payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
            : Map.of();
        this.requesterId = requesterId;
        this.submittedAt = submittedAt;
        this.status = status != null ? status : CrossingStatus.REQUESTED;
        this.auditTrail = copyOf(auditTrail);
        this.controlEvaluations = copyOf(controlEvaluations);
        this.appliedControls = copyOf(appliedControls);
        this.failureReason = failureReason;
        this.authorization = authorization;
        this.executionResult = executionResult;
        this.impact = impact;
        this.attestationIds = copyOf(attestationIds);
    }

    /**
     * Move to the next status, recording the event that caused it.
     *
     * @throws IllegalStateException if the transition is not allowed or the
     *         event does not match the target status
     */
    public void advance(CrossingStatus next, AuditEvent event) {
        Objects.requireNonNull(next, "next status must not be null");
        Objects.requireNonNull(event, "event must not be null");

        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Illegal crossing transition " + status + " -> " + next + " for " + requestId);
        }
        if (event.getEventType() != CrossingEventType.enteringStatus(next)) {
            throw new IllegalStateException(
                "Event " + event.getEventType() + " does not record entry into " + next);
        }
        append(event);
        this.status = next;
    }

    /**
     * Append an informational event that does not change status.
     */
    public void note(AuditEvent event) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Crossing " + requestId + " is closed (" + status + ")");
        }
        append(event);
    }

    public void recordControlEvaluations(List<ControlEvaluation> evaluations) {
        controlEvaluations.clear();
        controlEvaluations.addAll(evaluations);
    }

    public void recordAppliedControls(List<String> controlIds) {
        appliedControls.clear();
        appliedControls.addAll(controlIds);
    }

    public void recordFailureReason(String reason) {
        this.failureReason = reason;
    }

    /**
     * Authorization is single-assignment.
     *
     * @throws IllegalStateException if a decision was already recorded
     */
    public void recordAuthorization(AuthorizationDecision decision) {
        if (this.authorization != null) {
            throw new IllegalStateException("Authorization already recorded for " + requestId);
        }
        this.authorization = Objects.requireNonNull(decision, "decision must not be null");
    }

    public void recordExecution(ExecutionResult result) {
        this.executionResult = Objects.requireNonNull(result, "result must not be null");
    }

    public void recordImpact(ImpactAssessment assessment) {
        this.impact = Objects.requireNonNull(assessment, "assessment must not be null");
    }

    public void attachAttestation(String attestationId) {
        attestationIds.add(Objects.requireNonNull(attestationId, "attestationId must not be null"));
    }

    /**
     * Classification tag carried by the payload, if any.
     */
    public Optional<Classification> payloadClassification() {
        return Classification.fromTag(payload.get("classification"));
    }

    /**
     * Whether the crossing touches the given boundary on either side.
     */
    public boolean involves(String boundaryId) {
        return Objects.equals(boundaryId, sourceBoundaryId) || Objects.equals(boundaryId, targetBoundaryId);
    }

    public Optional<AuditEvent> lastEvent() {
        return auditTrail.isEmpty()
            ? Optional.empty()
            : Optional.of(auditTrail.get(auditTrail.size() - 1));
    }

    public List<AuditEvent> getAuditTrail() {
        return Collections.unmodifiableList(auditTrail);
    }

    public List<ControlEvaluation> getControlEvaluations() {
        return Collections.unmodifiableList(controlEvaluations);
    }

    public List<String> getAppliedControls() {
        return Collections.unmodifiableList(appliedControls);
    }

    public List<String> getAttestationIds() {
        return Collections.unmodifiableList(attestationIds);
    }

    private void append(AuditEvent event) {
        lastEvent().ifPresent(last -> {
            if (event.getTimestamp().isBefore(last.getTimestamp())) {
                throw new IllegalStateException("Audit trail must be non-decreasing in time");
            }
        });
        auditTrail.add(event);
    }

    private static <T> List<T> copyOf(List<T> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "CrossingRequest[id=" + requestId
            + ", source=" + sourceBoundaryId
            + ", target=" + targetBoundaryId
            + ", kind=" + crossingKind
            + ", status=" + status
            + ", events=" + auditTrail.size() + "]";
    }
}
