package com.trustboundary.infrastructure.persistence;

import com.trustboundary.domain.model.VerificationRecord;
import com.trustboundary.domain.repository.VerificationRepository;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.SealService;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Verification records stored in {@code verifications.json}. Append-only.
 */
public class JsonVerificationRepository implements VerificationRepository {

    public static final String FILE_NAME = "verifications.json";

    private final SealedJsonLedger<VerificationRecord> ledger;

    public JsonVerificationRepository(Path directory, CanonicalJson json, SealService sealService,
                                      boolean verifySealOnLoad) {
        this.ledger = new SealedJsonLedger<>(directory.resolve(FILE_NAME), "verifications",
            VerificationRecord.class, VerificationRecord::getVerificationId, json, sealService);
        ledger.load(verifySealOnLoad);
    }

    @Override
    public Optional<VerificationRecord> findById(String verificationId) {
        return ledger.find(verificationId);
    }

    @Override
    public List<VerificationRecord> findAll() {
        return ledger.all();
    }

    @Override
    public void append(VerificationRecord record) {
        ledger.append(record);
    }

    @Override
    public long count() {
        return ledger.size();
    }
}
