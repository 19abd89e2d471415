package com.trustboundary.domain.repository;

import com.trustboundary.domain.model.VerificationRecord;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store for signed verification records.
 *
 * @since 1.0.0
 */
public interface VerificationRepository {

    Optional<VerificationRecord> findById(String verificationId);

    List<VerificationRecord> findAll();

    /**
     * Append a new record.
     *
     * @param record signed record
     * @throws IllegalStateException if a record with the same id already exists
     */
    void append(VerificationRecord record);

    long count();
}
