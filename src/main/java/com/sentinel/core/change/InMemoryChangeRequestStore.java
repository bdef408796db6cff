package com.sentinel.core.change;

import com.sentinel.core.error.ConflictException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link ChangeRequestStore}. Version checks are atomic per request.
 */
public class InMemoryChangeRequestStore implements ChangeRequestStore {

    private final Map<UUID, ChangeRequest> requests = new ConcurrentHashMap<>();

    @Override
    public long save(ChangeRequest request, long expectedVersion) {
        long newVersion = expectedVersion + 1;
        requests.compute(request.getId(), (id, stored) -> {
            long storedVersion = stored == null ? 0 : stored.getVersion();
            if (storedVersion != expectedVersion) {
                throw new ConflictException("Change request " + id + " is at version " + storedVersion
                        + ", expected " + expectedVersion);
            }
            ChangeRequest copy = request.copy();
            copy.setVersion(newVersion);
            return copy;
        });
        request.setVersion(newVersion);
        return newVersion;
    }

    @Override
    public void delete(UUID id, long expectedVersion) {
        requests.computeIfPresent(id, (key, stored) -> {
            if (stored.getVersion() != expectedVersion) {
                throw new ConflictException("Change request " + id + " is at version " + stored.getVersion()
                        + ", expected " + expectedVersion);
            }
            return null;
        });
    }

    @Override
    public Optional<ChangeRequest> load(UUID id) {
        ChangeRequest stored = requests.get(id);
        return Optional.ofNullable(stored == null ? null : stored.copy());
    }

    @Override
    public List<ChangeRequest> list() {
        return requests.values().stream()
                .sorted(Comparator.comparing(ChangeRequest::getCreatedAt))
                .map(ChangeRequest::copy)
                .toList();
    }
}
