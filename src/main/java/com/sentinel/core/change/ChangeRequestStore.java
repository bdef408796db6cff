package com.sentinel.core.change;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for change requests with optimistic versioning.
 */
public interface ChangeRequestStore {

    /**
     * Writes the request if the stored version equals {@code expectedVersion}
     * (0 for a request that has never been stored), sets the new version on
     * {@code request} and returns it.
     *
     * @throws com.sentinel.core.error.ConflictException if another writer got there first
     */
    long save(ChangeRequest request, long expectedVersion);

    /**
     * Removes a request that was never recorded in the ledger.
     *
     * @throws com.sentinel.core.error.ConflictException if the stored version differs
     */
    void delete(UUID id, long expectedVersion);

    /**
     * Returns an independent copy of the stored request.
     */
    Optional<ChangeRequest> load(UUID id);

    /**
     * All requests, oldest first.
     */
    List<ChangeRequest> list();
}
