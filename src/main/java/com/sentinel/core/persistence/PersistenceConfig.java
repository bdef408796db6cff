package com.sentinel.core.persistence;

import com.sentinel.core.breakglass.BreakGlassStore;
import com.sentinel.core.breakglass.InMemoryBreakGlassStore;
import com.sentinel.core.change.ChangeRequestStore;
import com.sentinel.core.change.InMemoryChangeRequestStore;
import com.sentinel.core.gate.GateExecutionStore;
import com.sentinel.core.gate.InMemoryGateExecutionStore;
import com.sentinel.core.ledger.InMemoryLedgerStore;
import com.sentinel.core.ledger.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that provides the persistence ports.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), JDBC stores
 * are created and their tables ensured on startup. Otherwise in-memory stores are used:
 * suitable for development and testing, but nothing survives a restart.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public LedgerStore ledgerStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory ledger store (events will not persist across restarts)");
            return new InMemoryLedgerStore();
        }
        log.info("Configuring JDBC ledger store");
        JdbcLedgerStore store = new JdbcLedgerStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public ChangeRequestStore changeRequestStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new InMemoryChangeRequestStore();
        }
        JdbcChangeRequestStore store = new JdbcChangeRequestStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public GateExecutionStore gateExecutionStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new InMemoryGateExecutionStore();
        }
        JdbcGateExecutionStore store = new JdbcGateExecutionStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public BreakGlassStore breakGlassStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new InMemoryBreakGlassStore();
        }
        JdbcBreakGlassStore store = new JdbcBreakGlassStore(ds);
        store.createTables();
        return store;
    }
}
