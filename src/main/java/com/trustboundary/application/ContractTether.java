package com.trustboundary.application;

import com.trustboundary.application.exceptions.ContractTetherException;
import com.trustboundary.infrastructure.audit.AuditService;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.SealService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Precondition run before every mutating governance operation.
 *
 * <p>The caller-visible state (operation, time, current record count) is handed
 * to the seal service for an external verdict. A negative verdict, or a seal
 * service that cannot answer, aborts the operation before anything is changed.
 */
@Slf4j
@RequiredArgsConstructor
public class ContractTether {

    private final SealService sealService;
    private final CanonicalJson json;
    private final Clock clock;
    private final AuditService auditService;

    /**
     * @throws ContractTetherException if the operation may not proceed
     */
    public void check(String component, String operation, long recordCount) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("operation", operation);
        snapshot.put("timestamp", clock.instant());
        snapshot.put("record_count", recordCount);

        boolean verified;
        try {
            verified = sealService.verifyContractTether(component, operation, json.write(snapshot));
        } catch (RuntimeException e) {
            log.error("CONTRACT TETHER ERROR: {}.{} could not be verified", component, operation, e);
            auditService.record(AuditService.TETHER, "REJECTED", component, null, operation + ": " + e.getMessage());
            throw new ContractTetherException(component, operation, e);
        }

        if (!verified) {
            log.error("CONTRACT TETHER VIOLATION: {}.{} (records={})", component, operation, recordCount);
            auditService.record(AuditService.TETHER, "REJECTED", component, null, operation);
            throw new ContractTetherException(component, operation);
        }
    }
}
