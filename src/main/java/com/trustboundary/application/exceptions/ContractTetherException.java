package com.trustboundary.application.exceptions;

/**
 * The contract-tether precondition of a mutating operation failed. Nothing was changed.
 */
public class ContractTetherException extends RuntimeException {

    private final String component;
    private final String operation;

    public ContractTetherException(String component, String operation) {
        super("Contract tether check failed for " + component + "." + operation);
        this.component = component;
        this.operation = operation;
    }

    public ContractTetherException(String component, String operation, Throwable cause) {
        super("Contract tether check failed for " + component + "." + operation, cause);
        this.component = component;
        this.operation = operation;
    }

    public String getComponent() {
        return component;
    }

    public String getOperation() {
        return operation;
    }
}
