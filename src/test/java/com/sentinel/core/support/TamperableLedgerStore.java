package com.sentinel.core.support;

import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.InMemoryLedgerStore;
import com.sentinel.core.ledger.LedgerStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Ledger store that lets a test rewrite stored events behind the ledger's back.
 */
public class TamperableLedgerStore implements LedgerStore {

    private final InMemoryLedgerStore delegate = new InMemoryLedgerStore();
    private final Map<Long, AuditEvent> overrides = new ConcurrentHashMap<>();

    public void tamper(long sequence, UnaryOperator<AuditEvent> change) {
        AuditEvent original = delegate.readRange(sequence, sequence).get(0);
        overrides.put(sequence, change.apply(original));
    }

    @Override
    public void appendEvent(AuditEvent event) {
        delegate.appendEvent(event);
    }

    @Override
    public Optional<AuditEvent> readTip() {
        return delegate.readTip().map(this::view);
    }

    @Override
    public List<AuditEvent> readRange(long from, long to) {
        List<AuditEvent> events = new ArrayList<>();
        for (AuditEvent e : delegate.readRange(from, to)) {
            events.add(view(e));
        }
        return events;
    }

    @Override
    public Optional<AuditEvent> findById(UUID id) {
        return delegate.findById(id).map(this::view);
    }

    @Override
    public List<AuditEvent> readLatest(int limit) {
        return delegate.readLatest(limit).stream().map(this::view).toList();
    }

    private AuditEvent view(AuditEvent event) {
        return overrides.getOrDefault(event.sequence(), event);
    }
}
