package com.sentinel.core.ledger;

import com.sentinel.core.error.ConflictException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Non-durable {@link LedgerStore} used when no DataSource is configured.
 * Events are held in sequence order; index {@code i} holds sequence {@code i + 1}.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final List<AuditEvent> events = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void appendEvent(AuditEvent event) {
        lock.writeLock().lock();
        try {
            long expected = events.size() + 1L;
            if (event.sequence() != expected) {
                throw new ConflictException("Sequence " + event.sequence()
                        + " rejected; next free sequence is " + expected);
            }
            events.add(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<AuditEvent> readTip() {
        lock.readLock().lock();
        try {
            return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEvent> readRange(long from, long to) {
        lock.readLock().lock();
        try {
            long size = events.size();
            long start = Math.min(Math.max(0L, from - 1), size);
            long end = Math.min(Math.max(0L, to), size);
            if (start >= end) {
                return List.of();
            }
            return List.copyOf(events.subList((int) start, (int) end));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<AuditEvent> findById(UUID id) {
        lock.readLock().lock();
        try {
            return events.stream().filter(e -> e.id().equals(id)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEvent> readLatest(int limit) {
        lock.readLock().lock();
        try {
            List<AuditEvent> latest = new ArrayList<>();
            for (int i = events.size() - 1; i >= 0 && latest.size() < limit; i--) {
                latest.add(events.get(i));
            }
            return latest;
        } finally {
            lock.readLock().unlock();
        }
    }
}
