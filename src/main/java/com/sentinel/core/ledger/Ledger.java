package com.sentinel.core.ledger;

import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.TamperDetectedException;
import com.sentinel.core.error.ValidationException;
import com.sentinel.core.metrics.SentinelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained audit ledger.
 * <p>
 * The ledger is the single authoritative writer of the chain tip:
 * <ul>
 *   <li>appends serialize through one exclusive section, so sequence numbers
 *       are gap-free and every previous hash is unambiguous</li>
 *   <li>the cached tip is re-verified whenever it is (re)loaded from the store;
 *       a failure halts all further appends with {@link TamperDetectedException}</li>
 *   <li>a store-level duplicate sequence means another writer won the race and
 *       surfaces as {@link ConflictException}; the cached tip is dropped so the
 *       next append starts from the refreshed tip</li>
 * </ul>
 */
@Service
public class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final LedgerStore store;
    private final EventHasher hasher;
    private final Clock clock;
    private final SentinelMetrics metrics;

    private final ReentrantLock writeLock = new ReentrantLock();

    // guarded by writeLock
    private AuditEvent tip;
    private boolean tipLoaded;
    private TamperDetectedException haltCause;

    public Ledger(LedgerStore store, EventHasher hasher, Clock clock,
                  @Autowired(required = false) SentinelMetrics metrics) {
        this.store = store;
        this.hasher = hasher;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Appends an event against the current tip.
     *
     * @throws TamperDetectedException if the stored tip fails re-verification
     * @throws ConflictException       if another writer claimed the same sequence
     */
    public AppendResult append(AuditEventDraft draft) {
        return append(draft, null, false);
    }

    /**
     * Appends an event only if the chain tip still has the hash the caller observed.
     *
     * @param expectedPreviousHash hash of the tip the caller built on ({@code null} for an empty ledger)
     * @throws ConflictException if the tip moved
     */
    public AppendResult append(AuditEventDraft draft, String expectedPreviousHash) {
        return append(draft, expectedPreviousHash, true);
    }

    private AppendResult append(AuditEventDraft draft, String expectedPreviousHash, boolean checkExpected) {
        Objects.requireNonNull(draft, "draft must not be null");
        Map<String, Object> context = hasher.normalize(draft.context());

        writeLock.lock();
        try {
            ensureTipLoaded();
            String previousHash = tip == null ? null : tip.eventHash();
            if (checkExpected && !Objects.equals(expectedPreviousHash, previousHash)) {
                recordConflict();
                throw new ConflictException("Chain tip moved: expected " + abbreviate(expectedPreviousHash)
                        + " but found " + abbreviate(previousHash));
            }

            long sequence = tip == null ? 1 : tip.sequence() + 1;
            UUID id = draft.id() != null ? draft.id() : UUID.randomUUID();
            Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);

            AuditEvent unsigned = new AuditEvent(id, sequence, draft.eventType(), draft.action(), draft.actor(),
                    draft.resource(), draft.outcome(), context, previousHash, null, createdAt);
            AuditEvent event = new AuditEvent(id, sequence, draft.eventType(), draft.action(), draft.actor(),
                    draft.resource(), draft.outcome(), context, previousHash, hasher.computeHash(unsigned), createdAt);

            try {
                store.appendEvent(event);
            } catch (ConflictException e) {
                tip = null;
                tipLoaded = false;
                recordConflict();
                log.warn("Ledger append lost race at sequence {}: {}", sequence, e.getMessage());
                throw e;
            }

            tip = event;
            if (metrics != null) {
                metrics.recordLedgerAppend(draft.eventType().name());
            }
            log.debug("Appended {} at sequence {} ({})", draft.eventType(), sequence, abbreviate(event.eventHash()));
            return new AppendResult(id, sequence, event.eventHash());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Recomputes every hash in {@code [from, to]} plus the link to the event before {@code from}.
     * Stops at the first violation. A range that starts past the stored tip has nothing to
     * check and verifies with zero events.
     */
    public ChainVerification verifyChain(long from, long to) {
        if (from < 1 || to < from) {
            throw new ValidationException("Invalid verification range [" + from + ", " + to + "]");
        }
        long tipSequence = store.readTip().map(AuditEvent::sequence).orElse(0L);
        if (from > tipSequence) {
            log.debug("Verification range [{}, {}] starts past tip {}", from, to, tipSequence);
            return report(ChainVerification.ok(0));
        }

        AuditEvent previous = null;
        if (from > 1) {
            List<AuditEvent> before = store.readRange(from - 1, from - 1);
            if (before.isEmpty()) {
                return report(ChainVerification.broken(from - 1, "event is missing", 0));
            }
            previous = before.get(0);
        }

        long expected = from;
        long checked = 0;
        for (AuditEvent event : store.readRange(from, to)) {
            checked++;
            Violation violation = inspect(event, previous, expected);
            if (violation != null) {
                return report(ChainVerification.broken(violation.sequence(), violation.reason(), checked));
            }
            previous = event;
            expected++;
        }
        return report(ChainVerification.ok(checked));
    }

    /**
     * Verifies the whole chain from the first event to the current tip.
     */
    public ChainVerification verifyChain() {
        Optional<AuditEvent> current = store.readTip();
        if (current.isEmpty()) {
            return report(ChainVerification.ok(0));
        }
        return verifyChain(1, current.get().sequence());
    }

    /**
     * Verifies only the stored tip and its link to its predecessor.
     */
    public ChainVerification verifyTip() {
        Optional<AuditEvent> current = store.readTip();
        if (current.isEmpty()) {
            return ChainVerification.ok(0);
        }
        long sequence = current.get().sequence();
        return verifyChain(sequence, sequence);
    }

    public Optional<AuditEvent> tip() {
        return store.readTip();
    }

    public List<AuditEvent> events(long from, long to) {
        return store.readRange(from, to);
    }

    public Optional<AuditEvent> findEvent(UUID id) {
        return store.findById(id);
    }

    public List<AuditEvent> latest(int limit) {
        return store.readLatest(limit);
    }

    /**
     * True once a tip re-verification failed; appends are refused until restart.
     */
    public boolean isHalted() {
        writeLock.lock();
        try {
            return haltCause != null;
        } finally {
            writeLock.unlock();
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void ensureTipLoaded() {
        if (haltCause != null) {
            throw new TamperDetectedException(haltCause.sequence(), "ledger halted after integrity failure");
        }
        if (tipLoaded) {
            return;
        }

        Optional<AuditEvent> stored = store.readTip();
        if (stored.isPresent()) {
            AuditEvent candidate = stored.get();
            AuditEvent predecessor = null;
            if (candidate.sequence() > 1) {
                List<AuditEvent> before = store.readRange(candidate.sequence() - 1, candidate.sequence() - 1);
                if (before.isEmpty()) {
                    throw halt(new TamperDetectedException(candidate.sequence() - 1, "event is missing"));
                }
                predecessor = before.get(0);
            }
            Violation violation = inspect(candidate, predecessor, candidate.sequence());
            if (violation != null) {
                throw halt(new TamperDetectedException(violation.sequence(), violation.reason()));
            }
            tip = candidate;
        } else {
            tip = null;
        }
        tipLoaded = true;
    }

    private TamperDetectedException halt(TamperDetectedException cause) {
        haltCause = cause;
        log.error("Ledger halted: {}", cause.getMessage());
        return cause;
    }

    private Violation inspect(AuditEvent event, AuditEvent previous, long expectedSequence) {
        if (event.sequence() < expectedSequence) {
            return new Violation(event.sequence(), "duplicate sequence");
        }
        if (event.sequence() > expectedSequence) {
            return new Violation(expectedSequence, "sequence gap (next stored event is " + event.sequence() + ")");
        }
        if (event.sequence() == 1 && event.previousHash() != null) {
            return new Violation(1, "first event carries a previous hash");
        }
        if (event.sequence() > 1 && previous != null
                && !Objects.equals(event.previousHash(), previous.eventHash())) {
            return new Violation(event.sequence(), "previous hash does not match event " + previous.sequence());
        }
        if (!Objects.equals(hasher.computeHash(event), event.eventHash())) {
            return new Violation(event.sequence(), "event hash mismatch");
        }
        return null;
    }

    private ChainVerification report(ChainVerification result) {
        if (!result.valid()) {
            log.error("Audit chain verification failed at sequence {}: {}", result.firstMismatch(), result.reason());
        }
        if (metrics != null) {
            metrics.recordChainVerification(result.valid());
        }
        return result;
    }

    private void recordConflict() {
        if (metrics != null) {
            metrics.recordLedgerConflict();
        }
    }

    private static String abbreviate(String hash) {
        if (hash == null) {
            return "<none>";
        }
        return hash.length() <= 12 ? hash : hash.substring(0, 12);
    }

    private record Violation(long sequence, String reason) {}
}
