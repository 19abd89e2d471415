package com.trustboundary.application.exceptions;

import com.trustboundary.domain.model.VerificationRecord;

/**
 * A verification ran to completion and was signed, but could not be stored.
 *
 * <p>The computed record is carried so the caller can keep or retry it. This is
 * distinct from a verification that was stored and found problems.
 */
public class UnpersistedVerificationException extends RuntimeException {

    private final transient VerificationRecord record;

    public UnpersistedVerificationException(VerificationRecord record, Throwable cause) {
        super("Verification " + record.getVerificationId() + " of boundary " + record.getBoundaryId()
            + " was computed but not persisted", cause);
        this.record = record;
    }

    public VerificationRecord getRecord() {
        return record;
    }
}
