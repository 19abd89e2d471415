package com.trustboundary.support;

import com.trustboundary.infrastructure.crypto.SealService;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic seal service for tests. Seals are derived from the content, so
 * a seal verifies only against the exact content it was created for.
 */
public class FakeSealService implements SealService {

    private boolean rejectAllSeals;
    private boolean tetherAllowed = true;
    private RuntimeException tetherError;
    private final List<String> tetherOperations = new ArrayList<>();

    @Override
    public String create(String content) {
        return "fake:" + Integer.toHexString(content.hashCode()) + ":" + content.length();
    }

    @Override
    public boolean verify(String content, String seal) {
        return !rejectAllSeals && content != null && create(content).equals(seal);
    }

    @Override
    public boolean verifyContractTether(String component, String operation, String stateSnapshot) {
        tetherOperations.add(component + "." + operation);
        if (tetherError != null) {
            throw tetherError;
        }
        return tetherAllowed;
    }

    public void rejectAllSeals() {
        this.rejectAllSeals = true;
    }

    public void denyTether() {
        this.tetherAllowed = false;
    }

    public void failTether(RuntimeException error) {
        this.tetherError = error;
    }

    public List<String> tetherOperations() {
        return tetherOperations;
    }
}
