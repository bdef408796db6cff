package com.sentinel.core.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventHasherTest {

    private final EventHasher hasher = new EventHasher();

    private static final UUID ID = UUID.fromString("0b6a1f4e-7c3d-4f59-9a51-2e8c1d6b3a70");
    private static final Instant AT = Instant.parse("2026-03-01T09:00:00.250Z");

    private static AuditEvent event(Map<String, Object> context, String previousHash) {
        return new AuditEvent(ID, 2, AuditEventType.GATE_EXECUTED, "gate.evaluate", Actor.agent("deployer"),
                null, EventOutcome.SUCCESS, context, previousHash, null, AT);
    }

    @Test
    @DisplayName("canonical form sorts keys and writes nulls explicitly")
    void canonicalFormIsSortedWithExplicitNulls() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("zeta", 1);
        context.put("alpha", null);

        String canonical = hasher.canonicalize(event(context, null));

        assertTrue(canonical.startsWith("{\"action\":\"gate.evaluate\",\"actorId\":\"deployer\""), canonical);
        assertTrue(canonical.contains("\"context\":{\"alpha\":null,\"zeta\":1}"), canonical);
        assertTrue(canonical.contains("\"resourceId\":null"), canonical);
        assertTrue(canonical.contains("\"createdAt\":\"2026-03-01T09:00:00.250Z\""), canonical);
    }

    @Test
    @DisplayName("context insertion order does not change the hash")
    void insertionOrderIrrelevant() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("x", "1");
        a.put("y", List.of(1, 2));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("y", List.of(1, 2));
        b.put("x", "1");

        assertEquals(hasher.computeHash(event(a, "abc")), hasher.computeHash(event(b, "abc")));
    }

    @Test
    @DisplayName("hash depends on the previous hash")
    void chainsPreviousHash() {
        Map<String, Object> ctx = Map.of("k", "v");

        String first = hasher.computeHash(event(ctx, "aaaa"));
        String second = hasher.computeHash(event(ctx, "aaab"));

        assertNotEquals(first, second);
        assertTrue(first.matches("[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("normalize turns typed values into plain JSON values")
    void normalizeProducesPlainValues() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("when", AT);
        ctx.put("kind", EventOutcome.BLOCKED);
        ctx.put("items", Arrays.asList("a", null));

        Map<String, Object> plain = hasher.normalize(ctx);

        assertEquals("2026-03-01T09:00:00.250Z", plain.get("when"));
        assertEquals("BLOCKED", plain.get("kind"));
        assertEquals(Arrays.asList("a", null), plain.get("items"));
        assertThrows(UnsupportedOperationException.class, () -> plain.put("extra", 1));
    }

    @Test
    @DisplayName("normalize reads decimals back as BigDecimal with their scale")
    void normalizeKeepsDecimalScale() {
        Map<String, Object> plain = hasher.normalize(Map.of("amount", new BigDecimal("10.50"), "ratio", 0.5d));

        assertEquals(new BigDecimal("10.50"), plain.get("amount"));
        assertEquals(new BigDecimal("0.5"), plain.get("ratio"));
        assertTrue(hasher.canonicalize(event(plain, null)).contains("\"amount\":10.50"));
    }

    @Test
    @DisplayName("normalize of an empty context is empty")
    void normalizeEmpty() {
        assertTrue(hasher.normalize(null).isEmpty());
        assertTrue(hasher.normalize(Map.of()).isEmpty());
    }
}
