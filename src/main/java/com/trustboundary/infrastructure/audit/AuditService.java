package com.trustboundary.infrastructure.audit;

/**
 * Records security-relevant governance events (denials, decay, violations, tether failures).
 * The default implementation writes structured log lines; replace the bean to ship them elsewhere.
 */
public interface AuditService {

    String CROSSING = "CROSSING";
    String TRUST_DECAY = "TRUST_DECAY";
    String VIOLATION = "VIOLATION";
    String TETHER = "TETHER";
    String VERIFICATION = "VERIFICATION";

    void record(String category, String action, String resourceId, String principalId, String detail);
}
