package com.sentinel.core.persistence;

import com.sentinel.core.change.ChangeRequest;
import com.sentinel.core.change.ChangeRequestStore;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link ChangeRequestStore} over the {@code change_requests} table.
 */
public class JdbcChangeRequestStore extends JdbcVersionedDocumentStore<ChangeRequest> implements ChangeRequestStore {

    public JdbcChangeRequestStore(DataSource dataSource) {
        super(dataSource, ChangeRequest.class, "change_requests");
    }

    @Override
    public long save(ChangeRequest request, long expectedVersion) {
        return saveDocument(request, expectedVersion);
    }

    @Override
    public void delete(UUID id, long expectedVersion) {
        deleteDocument(id, expectedVersion);
    }

    @Override
    public Optional<ChangeRequest> load(UUID id) {
        return loadDocument(id);
    }

    @Override
    public List<ChangeRequest> list() {
        return listDocuments();
    }

    @Override
    protected UUID idOf(ChangeRequest document) {
        return document.getId();
    }

    @Override
    protected String keyOf(ChangeRequest document) {
        return document.getChangeKey();
    }

    @Override
    protected String statusOf(ChangeRequest document) {
        return document.getStatus().name();
    }

    @Override
    protected Instant createdAtOf(ChangeRequest document) {
        return document.getCreatedAt();
    }

    @Override
    protected void setVersion(ChangeRequest document, long version) {
        document.setVersion(version);
    }
}
