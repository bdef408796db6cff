package com.sentinel.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores mutable aggregates as JSON documents guarded by an optimistic version column.
 * A write succeeds only if the stored version still equals the version the caller read.
 *
 * @param <T> aggregate type
 */
abstract class JdbcVersionedDocumentStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcVersionedDocumentStore.class);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Class<T> type;
    private final String tableName;

    private final String createTableSql;
    private final String insertSql;
    private final String updateSql;
    private final String deleteSql;
    private final String selectByIdSql;
    private final String selectAllSql;

    protected JdbcVersionedDocumentStore(DataSource dataSource, Class<T> type, String tableName) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = JdbcSupport.documentMapper();
        this.type = type;
        this.tableName = tableName;

        this.createTableSql = """
                CREATE TABLE IF NOT EXISTS %s (
                    id         VARCHAR(36) PRIMARY KEY,
                    doc_key    VARCHAR(255) NOT NULL,
                    status     VARCHAR(32) NOT NULL,
                    version    BIGINT NOT NULL,
                    document   TEXT NOT NULL,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL
                )
                """.formatted(tableName);
        this.insertSql = """
                INSERT INTO %s (id, doc_key, status, version, document, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """.formatted(tableName);
        this.updateSql = """
                UPDATE %s SET status = ?, version = ?, document = ?
                WHERE id = ? AND version = ?
                """.formatted(tableName);
        this.deleteSql = """
                DELETE FROM %s WHERE id = ? AND version = ?
                """.formatted(tableName);
        this.selectByIdSql = """
                SELECT document FROM %s WHERE id = ?
                """.formatted(tableName);
        this.selectAllSql = """
                SELECT document FROM %s ORDER BY created_at ASC, id ASC
                """.formatted(tableName);
    }

    protected abstract UUID idOf(T document);

    protected abstract String keyOf(T document);

    protected abstract String statusOf(T document);

    protected abstract Instant createdAtOf(T document);

    protected abstract void setVersion(T document, long version);

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(createTableSql)) {
            stmt.execute();
            log.info("Table '{}' ensured", tableName);
        }
    }

    protected long saveDocument(T document, long expectedVersion) {
        long newVersion = expectedVersion + 1;
        setVersion(document, newVersion);
        try {
            if (expectedVersion == 0) {
                insert(document, newVersion);
            } else {
                update(document, expectedVersion, newVersion);
            }
        } catch (RuntimeException e) {
            setVersion(document, expectedVersion);
            throw e;
        }
        return newVersion;
    }

    protected void deleteDocument(UUID id, long expectedVersion) {
        int deleted;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(deleteSql)) {
            stmt.setString(1, id.toString());
            stmt.setLong(2, expectedVersion);
            deleted = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete " + tableName + " row " + id, e);
        }
        if (deleted == 0 && loadDocument(id).isPresent()) {
            throw new ConflictException(tableName + " row " + id + " is no longer at version " + expectedVersion);
        }
    }

    protected Optional<T> loadDocument(UUID id) {
        List<T> found = query(selectByIdSql, id.toString());
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    protected List<T> listDocuments() {
        return query(selectAllSql);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void insert(T document, long version) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(insertSql)) {
            stmt.setString(1, idOf(document).toString());
            stmt.setString(2, keyOf(document));
            stmt.setString(3, statusOf(document));
            stmt.setLong(4, version);
            stmt.setString(5, serialize(document));
            stmt.setObject(6, JdbcSupport.toOffset(createdAtOf(document)));
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (JdbcSupport.isConstraintViolation(e)) {
                throw new ConflictException(tableName + " row " + idOf(document) + " already exists", e);
            }
            throw new PersistenceException("Failed to insert into " + tableName, e);
        }
    }

    private void update(T document, long expectedVersion, long newVersion) {
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(updateSql)) {
            stmt.setString(1, statusOf(document));
            stmt.setLong(2, newVersion);
            stmt.setString(3, serialize(document));
            stmt.setString(4, idOf(document).toString());
            stmt.setLong(5, expectedVersion);
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update " + tableName + " row " + idOf(document), e);
        }
        if (updated == 0) {
            throw new ConflictException(tableName + " row " + idOf(document)
                    + " is no longer at version " + expectedVersion);
        }
    }

    private List<T> query(String sql, Object... params) {
        List<T> documents = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    documents.add(deserialize(rs.getString("document")));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read from " + tableName, e);
        }
        return documents;
    }

    private String serialize(T document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    private T deserialize(String json) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
