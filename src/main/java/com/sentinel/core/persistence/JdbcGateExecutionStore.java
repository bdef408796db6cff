package com.sentinel.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.error.ConflictException;
import com.sentinel.core.error.PersistenceException;
import com.sentinel.core.gate.GateExecution;
import com.sentinel.core.gate.GateExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link GateExecutionStore}. Executions are append-only rows with the
 * full record as a JSON document plus a few indexed columns for lookups.
 */
public class JdbcGateExecutionStore implements GateExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcGateExecutionStore.class);

    private static final String TABLE_NAME = "gate_executions";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id           VARCHAR(36) PRIMARY KEY,
                execution_id VARCHAR(255),
                gate_key     VARCHAR(255),
                outcome      VARCHAR(16) NOT NULL,
                document     TEXT NOT NULL,
                created_at   TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, execution_id, gate_key, outcome, document, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT document FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_EXECUTION_SQL = """
            SELECT document FROM %s WHERE execution_id = ? ORDER BY created_at ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT document FROM %s ORDER BY created_at DESC LIMIT ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcGateExecutionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = JdbcSupport.documentMapper();
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Gate execution table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(GateExecution execution) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, execution.id().toString());
            stmt.setString(2, execution.executionId());
            stmt.setString(3, execution.gateKey());
            stmt.setString(4, execution.outcome().name());
            stmt.setString(5, objectMapper.writeValueAsString(execution));
            stmt.setObject(6, JdbcSupport.toOffset(execution.createdAt()));
            stmt.executeUpdate();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize gate execution " + execution.id(), e);
        } catch (SQLException e) {
            if (JdbcSupport.isConstraintViolation(e)) {
                throw new ConflictException("Gate execution " + execution.id() + " already stored", e);
            }
            throw new PersistenceException("Failed to store gate execution " + execution.id(), e);
        }
    }

    @Override
    public Optional<GateExecution> findById(UUID id) {
        List<GateExecution> found = query(SELECT_BY_ID_SQL, id.toString());
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<GateExecution> findByExecutionId(String executionId) {
        return query(SELECT_BY_EXECUTION_SQL, executionId);
    }

    @Override
    public List<GateExecution> recent(int limit) {
        return query(SELECT_RECENT_SQL, limit);
    }

    private List<GateExecution> query(String sql, Object param) {
        List<GateExecution> executions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    executions.add(objectMapper.readValue(rs.getString("document"), GateExecution.class));
                }
            }
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored gate execution is not readable", e);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read gate executions", e);
        }
        return executions;
    }
}
