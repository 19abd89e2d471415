package com.trustboundary.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.util.Set;

@Slf4j
public class LoggingAuditService implements AuditService {

    private static final Set<String> ALARM_ACTIONS = Set.of("DENIED", "FAILED", "REJECTED", "REPORTED", "DECAYED");

    @Override
    public void record(String category, String action, String resourceId, String principalId, String detail) {
        // Caller-supplied values end up in log files
        String safeResource = encode(resourceId);
        String safePrincipal = encode(principalId);
        String safeDetail = encode(detail);

        if (ALARM_ACTIONS.contains(action) || VIOLATION.equals(category) || TETHER.equals(category)) {
            log.warn("AUDIT category={} action={} resourceId={} principal={} detail={}",
                category, action, safeResource, safePrincipal, safeDetail);
        } else {
            log.info("AUDIT category={} action={} resourceId={} principal={} detail={}",
                category, action, safeResource, safePrincipal, safeDetail);
        }
    }

    private static String encode(String value) {
        return value == null ? null : Encode.forJava(value);
    }
}
