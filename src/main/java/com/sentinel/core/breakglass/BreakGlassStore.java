package com.sentinel.core.breakglass;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BreakGlassStore {

    /**
     * Writes the grant if the stored version equals {@code expectedVersion}
     * (0 for a new grant), sets the new version on {@code grant} and returns it.
     *
     * @throws com.sentinel.core.error.ConflictException on a version mismatch
     */
    long save(BreakGlassGrant grant, long expectedVersion);

    Optional<BreakGlassGrant> load(UUID id);

    List<BreakGlassGrant> list();
}
