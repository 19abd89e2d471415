package com.trustboundary.infrastructure.persistence;

import com.trustboundary.domain.model.CrossingRequest;
import com.trustboundary.domain.repository.CrossingRepository;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.SealService;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Crossing requests stored in {@code crossings.json}.
 */
public class JsonCrossingRepository implements CrossingRepository {

    public static final String FILE_NAME = "crossings.json";

    private final SealedJsonLedger<CrossingRequest> ledger;

    public JsonCrossingRepository(Path directory, CanonicalJson json, SealService sealService, boolean verifySealOnLoad) {
        this.ledger = new SealedJsonLedger<>(directory.resolve(FILE_NAME), "crossings",
            CrossingRequest.class, CrossingRequest::getRequestId, json, sealService);
        ledger.load(verifySealOnLoad);
    }

    @Override
    public Optional<CrossingRequest> findById(String requestId) {
        return ledger.find(requestId);
    }

    @Override
    public List<CrossingRequest> findAll() {
        return ledger.all();
    }

    @Override
    public void save(CrossingRequest request) {
        ledger.put(request);
    }

    @Override
    public long count() {
        return ledger.size();
    }
}
