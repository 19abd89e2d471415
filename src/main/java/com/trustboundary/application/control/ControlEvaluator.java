package com.trustboundary.application.control;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.Control;
import com.trustboundary.domain.model.ControlEvaluation;
import com.trustboundary.domain.model.ControlStatus;
import com.trustboundary.domain.model.CrossingRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates one boundary control against a crossing or against the boundary's
 * own configuration.
 *
 * <p>Evaluation never throws: a failing policy, limiter or malformed parameter
 * yields an {@link ControlStatus#INEFFECTIVE} result carrying the error as
 * evidence, so callers can always finish a complete report. The evaluator keeps
 * no state of its own; the only side effect is a permit taken from the rate
 * limiter during a crossing.
 *
 * <p>Any control can be switched off with {@code enabled=false}; a disabled
 * control is ineffective in every context.
 */
@Slf4j
public class ControlEvaluator {

    static final int DEFAULT_WINDOW_SECONDS = 60;

    private final RateLimiter rateLimiter;
    private final FilterPolicy filterPolicy;
    private final IsolationPolicy isolationPolicy;

    /**
     * @param rateLimiter limiter for {@code rate_limiting} controls, may be {@code null}
     * @param filterPolicy policy for {@code filtering} controls, may be {@code null}
     * @param isolationPolicy policy for {@code isolation} controls, may be {@code null}
     */
    public ControlEvaluator(RateLimiter rateLimiter, FilterPolicy filterPolicy, IsolationPolicy isolationPolicy) {
        this.rateLimiter = rateLimiter;
        this.filterPolicy = filterPolicy;
        this.isolationPolicy = isolationPolicy;
    }

    public ControlEvaluation evaluate(Control control, ControlContext context) {
        if (control.getControlType() == null) {
            return result(control, ControlStatus.INEFFECTIVE, "Unknown control kind", "control_type absent");
        }
        try {
            if (!control.flag("enabled", true)) {
                return result(control, ControlStatus.INEFFECTIVE, "Control is disabled", "enabled=false");
            }
            ControlEvaluation evaluation = context.isCrossing()
                ? evaluateCrossing(control, context.getRequest(), context.getBoundary())
                : evaluateConfiguration(control);
            log.debug("Control {} ({}) -> {}", control.getControlId(), control.getControlType(), evaluation.getStatus());
            return evaluation;
        } catch (RuntimeException e) {
            log.warn("Control {} check failed: {}", control.getControlId(), e.toString());
            return result(control, ControlStatus.INEFFECTIVE, "Control check failed: " + e.getMessage(), e.toString());
        }
    }

    private ControlEvaluation evaluateCrossing(Control control, CrossingRequest request, Boundary target) {
        Map<String, Object> payload = request.getPayload();

        return switch (control.getControlType()) {
            case AUTHENTICATION -> {
                String requester = request.getRequesterId();
                yield requester != null && !requester.isBlank()
                    ? result(control, ControlStatus.EFFECTIVE, "Requester identified", "requester_id=" + requester)
                    : result(control, ControlStatus.INEFFECTIVE, "Requester identity is missing", "requester_id absent");
            }
            case AUTHORIZATION -> {
                if (control.param("allowed_requesters") == null) {
                    yield result(control, ControlStatus.EFFECTIVE, "No requester restriction", "allowed_requesters unset");
                }
                List<String> allowed = control.listParam("allowed_requesters");
                yield allowed.contains(request.getRequesterId())
                    ? result(control, ControlStatus.EFFECTIVE, "Requester is allowed", "allowed_requesters=" + allowed)
                    : result(control, ControlStatus.INEFFECTIVE,
                        "Requester " + request.getRequesterId() + " is not allowed", "allowed_requesters=" + allowed);
            }
            case ENCRYPTION -> {
                boolean encrypted = Boolean.parseBoolean(String.valueOf(payload.get("encrypted")));
                if (control.flag("require_encrypted", false) && !encrypted) {
                    yield result(control, ControlStatus.INEFFECTIVE, "Payload must be encrypted", "encrypted=" + payload.get("encrypted"));
                }
                yield payload.containsKey("content_hash")
                    ? result(control, ControlStatus.EFFECTIVE, "Payload integrity protected", "content_hash present")
                    : result(control, ControlStatus.WARNING, "Payload lacks a content hash", "content_hash absent");
            }
            case VALIDATION -> {
                List<String> missing = control.listParam("required_fields").stream()
                    .filter(field -> !payload.containsKey(field))
                    .toList();
                yield missing.isEmpty()
                    ? result(control, ControlStatus.EFFECTIVE, "Payload carries required fields", "required_fields satisfied")
                    : result(control, ControlStatus.INEFFECTIVE, "Payload is missing required fields", "missing=" + missing);
            }
            case MONITORING, LOGGING ->
                result(control, ControlStatus.EFFECTIVE, "Crossing is recorded in the audit trail", "request_id=" + request.getRequestId());
            case FILTERING -> {
                if (filterPolicy == null) {
                    yield result(control, ControlStatus.DEGRADED, "No filter policy configured", "filter policy absent");
                }
                Optional<String> rejection = filterPolicy.reject(control, request);
                yield rejection
                    .map(reason -> result(control, ControlStatus.INEFFECTIVE, "Payload rejected by filter", reason))
                    .orElseGet(() -> result(control, ControlStatus.EFFECTIVE, "Payload passed filter", "no rejection"));
            }
            case RATE_LIMITING -> evaluateRateLimit(control, request);
            case ISOLATION -> {
                if (isolationPolicy == null) {
                    yield result(control, ControlStatus.DEGRADED, "No isolation policy configured", "isolation policy absent");
                }
                Optional<String> breach = isolationPolicy.breach(control, request, target);
                yield breach
                    .map(reason -> result(control, ControlStatus.INEFFECTIVE, "Crossing breaches isolation", reason))
                    .orElseGet(() -> result(control, ControlStatus.EFFECTIVE, "Isolation preserved",
                        "source=" + request.getSourceBoundaryId()));
            }
        };
    }

    private ControlEvaluation evaluateRateLimit(Control control, CrossingRequest request) {
        if (rateLimiter == null) {
            return result(control, ControlStatus.DEGRADED, "No rate limiter configured", "rate limiter absent");
        }
        int maxRequests = control.intParam("max_requests", -1);
        if (maxRequests < 0) {
            return result(control, ControlStatus.DEGRADED, "No request limit configured", "max_requests absent");
        }
        int windowSeconds = control.intParam("window_seconds", DEFAULT_WINDOW_SECONDS);
        String key = control.getControlId() + ":" + request.getRequesterId();

        return rateLimiter.tryAcquire(key, maxRequests, Duration.ofSeconds(windowSeconds))
            ? result(control, ControlStatus.EFFECTIVE, "Within rate limit",
                "limit=" + maxRequests + "/" + windowSeconds + "s")
            : result(control, ControlStatus.INEFFECTIVE, "Rate limit exceeded",
                "limit=" + maxRequests + "/" + windowSeconds + "s, key=" + key);
    }

    private ControlEvaluation evaluateConfiguration(Control control) {
        return switch (control.getControlType()) {
            case RATE_LIMITING -> {
                if (rateLimiter == null) {
                    yield result(control, ControlStatus.DEGRADED, "No rate limiter configured", "rate limiter absent");
                }
                yield control.param("max_requests") == null
                    ? result(control, ControlStatus.DEGRADED, "No request limit configured", "max_requests absent")
                    : result(control, ControlStatus.EFFECTIVE, "Rate limit configured",
                        "max_requests=" + control.param("max_requests"));
            }
            case ENCRYPTION -> control.param("algorithm") == null
                ? result(control, ControlStatus.DEGRADED, "No encryption algorithm configured", "algorithm absent")
                : result(control, ControlStatus.EFFECTIVE, "Encryption configured", "algorithm=" + control.param("algorithm"));
            case AUTHENTICATION, AUTHORIZATION, VALIDATION, MONITORING, LOGGING, FILTERING, ISOLATION ->
                result(control, ControlStatus.EFFECTIVE, "Control configured", "enabled");
        };
    }

    private static ControlEvaluation result(Control control, ControlStatus status, String detail, String evidence) {
        return ControlEvaluation.builder()
            .controlId(control.getControlId())
            .controlType(control.getControlType())
            .status(status)
            .detail(detail)
            .evidence(evidence)
            .build();
    }
}
