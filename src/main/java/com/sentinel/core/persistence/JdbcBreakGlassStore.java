package com.sentinel.core.persistence;

import com.sentinel.core.breakglass.BreakGlassGrant;
import com.sentinel.core.breakglass.BreakGlassStore;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link BreakGlassStore} over the {@code break_glass_grants} table.
 */
public class JdbcBreakGlassStore extends JdbcVersionedDocumentStore<BreakGlassGrant> implements BreakGlassStore {

    public JdbcBreakGlassStore(DataSource dataSource) {
        super(dataSource, BreakGlassGrant.class, "break_glass_grants");
    }

    @Override
    public long save(BreakGlassGrant grant, long expectedVersion) {
        return saveDocument(grant, expectedVersion);
    }

    @Override
    public Optional<BreakGlassGrant> load(UUID id) {
        return loadDocument(id);
    }

    @Override
    public List<BreakGlassGrant> list() {
        return listDocuments();
    }

    @Override
    protected UUID idOf(BreakGlassGrant document) {
        return document.getId();
    }

    @Override
    protected String keyOf(BreakGlassGrant document) {
        return document.getGrantKey();
    }

    @Override
    protected String statusOf(BreakGlassGrant document) {
        return document.getStatus().name();
    }

    @Override
    protected Instant createdAtOf(BreakGlassGrant document) {
        return document.getRequestedAt();
    }

    @Override
    protected void setVersion(BreakGlassGrant document, long version) {
        document.setVersion(version);
    }
}
