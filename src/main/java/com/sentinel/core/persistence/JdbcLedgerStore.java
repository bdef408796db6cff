package com.sentinel.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.PersistenceException;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.ledger.ActorType;
import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.AuditEventType;
import com.sentinel.core.ledger.EventOutcome;
import com.sentinel.core.ledger.LedgerStore;
import com.sentinel.core.ledger.ResourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link LedgerStore}. One row per audit event, keyed by sequence;
 * the context map is stored as a JSON text column.
 * <p>
 * The table {@code audit_events} is created by {@link #createTables()}. Rows are
 * only ever inserted; a duplicate sequence or id surfaces as {@link ConflictException}.
 */
public class JdbcLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcLedgerStore.class);

    static final String TABLE_NAME = "audit_events";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                sequence      BIGINT PRIMARY KEY,
                id            VARCHAR(36) NOT NULL UNIQUE,
                event_type    VARCHAR(64) NOT NULL,
                action        VARCHAR(255),
                actor_id      VARCHAR(255) NOT NULL,
                actor_type    VARCHAR(32) NOT NULL,
                resource_type VARCHAR(64),
                resource_id   VARCHAR(255),
                resource_name VARCHAR(255),
                outcome       VARCHAR(16) NOT NULL,
                context       TEXT NOT NULL,
                previous_hash VARCHAR(64),
                event_hash    VARCHAR(64) NOT NULL,
                created_at    TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String COLUMNS = """
            sequence, id, event_type, action, actor_id, actor_type, resource_type, resource_id,
            resource_name, outcome, context, previous_hash, event_hash, created_at""";

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_TIP_SQL = """
            SELECT %s FROM %s ORDER BY sequence DESC LIMIT 1
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_RANGE_SQL = """
            SELECT %s FROM %s WHERE sequence BETWEEN ? AND ? ORDER BY sequence ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT %s FROM %s ORDER BY sequence DESC LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcLedgerStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = JdbcSupport.documentMapper();
    }

    /**
     * Creates the audit table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Ledger table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void appendEvent(AuditEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            ResourceRef resource = event.resource();
            stmt.setLong(1, event.sequence());
            stmt.setString(2, event.id().toString());
            stmt.setString(3, event.eventType().name());
            stmt.setString(4, event.action());
            stmt.setString(5, event.actor().id());
            stmt.setString(6, event.actor().type().name());
            stmt.setString(7, resource == null ? null : resource.type());
            stmt.setString(8, resource == null ? null : resource.id());
            stmt.setString(9, resource == null ? null : resource.name());
            stmt.setString(10, event.outcome().name());
            stmt.setString(11, serializeContext(event.context()));
            stmt.setString(12, event.previousHash());
            stmt.setString(13, event.eventHash());
            stmt.setObject(14, JdbcSupport.toOffset(event.createdAt()));
            stmt.executeUpdate();
            log.debug("Stored audit event {} at sequence {}", event.id(), event.sequence());
        } catch (SQLException e) {
            if (JdbcSupport.isConstraintViolation(e)) {
                throw new ConflictException("Sequence " + event.sequence() + " is already taken", e);
            }
            throw new PersistenceException("Failed to store audit event " + event.sequence(), e);
        }
    }

    @Override
    public Optional<AuditEvent> readTip() {
        List<AuditEvent> tip = query(SELECT_TIP_SQL, "read chain tip");
        return tip.isEmpty() ? Optional.empty() : Optional.of(tip.get(0));
    }

    @Override
    public List<AuditEvent> readRange(long from, long to) {
        return query(SELECT_RANGE_SQL, "read sequences " + from + ".." + to, from, to);
    }

    @Override
    public Optional<AuditEvent> findById(UUID id) {
        List<AuditEvent> found = query(SELECT_BY_ID_SQL, "find event " + id, id.toString());
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<AuditEvent> readLatest(int limit) {
        return query(SELECT_LATEST_SQL, "read latest events", limit);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private List<AuditEvent> query(String sql, String what, Object... params) {
        List<AuditEvent> events = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to " + what, e);
        }
        return events;
    }

    private AuditEvent fromResultSet(ResultSet rs) throws SQLException {
        String resourceType = rs.getString("resource_type");
        ResourceRef resource = resourceType == null ? null
                : new ResourceRef(resourceType, rs.getString("resource_id"), rs.getString("resource_name"));
        return new AuditEvent(
                UUID.fromString(rs.getString("id")),
                rs.getLong("sequence"),
                AuditEventType.valueOf(rs.getString("event_type")),
                rs.getString("action"),
                new Actor(rs.getString("actor_id"), ActorType.valueOf(rs.getString("actor_type"))),
                resource,
                EventOutcome.valueOf(rs.getString("outcome")),
                deserializeContext(rs.getString("context")),
                rs.getString("previous_hash"),
                rs.getString("event_hash"),
                JdbcSupport.toInstant(rs.getObject("created_at", OffsetDateTime.class)));
    }

    private String serializeContext(Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize event context", e);
        }
    }

    /**
     * Unreadable context is kept as raw text so chain verification reports the
     * damaged event instead of failing the whole read.
     */
    private Map<String, Object> deserializeContext(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            log.warn("Stored event context is not valid JSON: {}", e.getOriginalMessage());
            return Map.of("unreadableContext", json);
        }
    }
}
