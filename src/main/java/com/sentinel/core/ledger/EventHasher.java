package com.sentinel.core.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the canonical form and SHA-256 chain hash of audit events.
 * <p>
 * Canonical form is compact JSON with:
 * <ul>
 *   <li>object keys sorted at every nesting level</li>
 *   <li>{@code null} values written explicitly, never omitted</li>
 *   <li>timestamps as ISO-8601 UTC strings ({@code Instant#toString})</li>
 * </ul>
 * The digest input is the canonical UTF-8 bytes followed by the previous
 * event's hash (nothing for the first event). Output is lowercase hex.
 */
@Component
public class EventHasher {

    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .serializationInclusion(JsonInclude.Include.ALWAYS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    /**
     * Recomputes the hash of a stored event from its own fields and previous hash.
     */
    public String computeHash(AuditEvent event) {
        return digest(canonicalize(event), event.previousHash());
    }

    /**
     * Canonical JSON of every hashed field of the event. The previous and self
     * hashes are not part of the canonical form.
     */
    public String canonicalize(AuditEvent event) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("id", event.id() == null ? null : event.id().toString());
        fields.put("sequence", event.sequence());
        fields.put("eventType", event.eventType() == null ? null : event.eventType().name());
        fields.put("action", event.action());
        fields.put("actorId", event.actor() == null ? null : event.actor().id());
        fields.put("actorType", event.actor() == null ? null : event.actor().type().name());
        ResourceRef resource = event.resource();
        fields.put("resourceType", resource == null ? null : resource.type());
        fields.put("resourceId", resource == null ? null : resource.id());
        fields.put("resourceName", resource == null ? null : resource.name());
        fields.put("outcome", event.outcome() == null ? null : event.outcome().name());
        fields.put("context", event.context());
        fields.put("createdAt", event.createdAt() == null ? null : event.createdAt().toString());
        try {
            return canonicalMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit event " + event.id() + " is not serializable", e);
        }
    }

    /**
     * Converts a caller-supplied context into plain JSON values (maps, lists,
     * strings, numbers, booleans, nulls) by writing it as JSON text and reading
     * it back. Decimals come back as {@link java.math.BigDecimal} with their
     * scale intact, exactly as the JDBC store reads them, so a stored event
     * re-hashes to the same value.
     */
    public Map<String, Object> normalize(Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return Map.of();
        }
        try {
            String json = canonicalMapper.writeValueAsString(context);
            Map<String, Object> plain = canonicalMapper.readValue(json,
                    new TypeReference<LinkedHashMap<String, Object>>() {});
            return Collections.unmodifiableMap(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event context is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private String digest(String canonical, String previousHash) {
        MessageDigest sha256 = newDigest();
        sha256.update(canonical.getBytes(StandardCharsets.UTF_8));
        if (previousHash != null) {
            sha256.update(previousHash.getBytes(StandardCharsets.UTF_8));
        }
        return HEX.formatHex(sha256.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
