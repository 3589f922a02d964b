package com.lifecycle.engine.projection;

import com.lifecycle.core.exception.ProjectionWriteViolationException;
import com.lifecycle.core.projection.ReadModelStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The store a projector sees while applying an event.
 * Writes are limited to the tables the projector owns.
 */
public class ScopedReadModelStore implements ReadModelStore {

    private final String projectorName;
    private final Set<String> ownedTables;
    private final ReadModelStore delegate;

    public ScopedReadModelStore(String projectorName, Set<String> ownedTables, ReadModelStore delegate) {
        this.projectorName = projectorName;
        this.ownedTables = Set.copyOf(ownedTables);
        this.delegate = delegate;
    }

    @Override
    public Optional<Map<String, Object>> find(String table, Map<String, Object> key) {
        return delegate.find(table, key);
    }

    @Override
    public List<Map<String, Object>> findWhere(String table, String column, Object value) {
        return delegate.findWhere(table, column, value);
    }

    @Override
    public List<Map<String, Object>> findAll(String table) {
        return delegate.findAll(table);
    }

    @Override
    public void upsert(String table, Map<String, Object> row) {
        checkOwned(table, "upsert");
        delegate.upsert(table, row);
    }

    @Override
    public void delete(String table, Map<String, Object> key) {
        checkOwned(table, "delete");
        delegate.delete(table, key);
    }

    @Override
    public void truncate(String table) {
        checkOwned(table, "truncate");
        delegate.truncate(table);
    }

    @Override
    public long count(String table) {
        return delegate.count(table);
    }

    private void checkOwned(String table, String operation) {
        if (!ownedTables.contains(table)) {
            throw new ProjectionWriteViolationException(projectorName, table, operation);
        }
    }
}
