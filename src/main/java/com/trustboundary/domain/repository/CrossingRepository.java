package com.trustboundary.domain.repository;

import com.trustboundary.domain.model.CrossingRequest;

import java.util.List;
import java.util.Optional;

/**
 * Store for crossing requests.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Hand out copies, so a caller mutating a request cannot touch stored state
 *       until it calls {@link #save}</li>
 *   <li>Make {@link #save} all-or-nothing: on failure the previously stored
 *       version stays in place and a {@code PersistenceException} is thrown</li>
 *   <li>Never delete requests</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface CrossingRepository {

    Optional<CrossingRequest> findById(String requestId);

    /**
     * All stored requests, ordered by request id.
     */
    List<CrossingRequest> findAll();

    /**
     * Insert or replace a request.
     *
     * @param request request to store
     */
    void save(CrossingRequest request);

    long count();
}
