package com.sentinel.core.breakglass;

import com.sentinel.core.error.ConflictException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBreakGlassStore implements BreakGlassStore {

    private final Map<UUID, BreakGlassGrant> grants = new ConcurrentHashMap<>();

    @Override
    public long save(BreakGlassGrant grant, long expectedVersion) {
        long newVersion = expectedVersion + 1;
        grants.compute(grant.getId(), (id, stored) -> {
            long storedVersion = stored == null ? 0 : stored.getVersion();
            if (storedVersion != expectedVersion) {
                throw new ConflictException("Break-glass grant " + id + " is at version " + storedVersion
                        + ", expected " + expectedVersion);
            }
            BreakGlassGrant copy = grant.copy();
            copy.setVersion(newVersion);
            return copy;
        });
        grant.setVersion(newVersion);
        return newVersion;
    }

    @Override
    public Optional<BreakGlassGrant> load(UUID id) {
        BreakGlassGrant stored = grants.get(id);
        return Optional.ofNullable(stored == null ? null : stored.copy());
    }

    @Override
    public List<BreakGlassGrant> list() {
        return grants.values().stream()
                .sorted(Comparator.comparing(BreakGlassGrant::getRequestedAt))
                .map(BreakGlassGrant::copy)
                .toList();
    }
}
