package com.lifecycle.engine.persistence;

import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.projection.ReadModelTable;
import com.lifecycle.engine.projection.ReadModelCatalog;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of ReadModelStore.
 * Rows are keyed by the values of the table's key columns.
 *
 * Writes made between {@link #begin()} and {@link #commit()} on one thread
 * are staged and only visible to that thread; {@link #rollback()} drops
 * them. Outside a transaction writes apply immediately.
 */
public class InMemoryReadModelStore implements ReadModelStore {

    private final ReadModelCatalog catalog;
    private final ConcurrentMap<String, ConcurrentMap<List<Object>, Map<String, Object>>> tables =
        new ConcurrentHashMap<>();
    private final ThreadLocal<Staging> staging = new ThreadLocal<>();

    public InMemoryReadModelStore(ReadModelCatalog catalog) {
        this.catalog = catalog;
    }

    // ========== Transactions ==========

    public boolean inTransaction() {
        return staging.get() != null;
    }

    public void begin() {
        if (inTransaction()) {
            throw new IllegalStateException("Read model transaction already open on this thread");
        }
        staging.set(new Staging());
    }

    /**
     * Apply the staged writes: truncations first, then row writes in the
     * order they were made.
     */
    public void commit() {
        Staging staged = requireStaging();
        staging.remove();
        for (String table : staged.truncated) {
            rows(table).clear();
        }
        staged.rows.forEach((table, changes) -> {
            ConcurrentMap<List<Object>, Map<String, Object>> committed = rows(table);
            changes.forEach((key, row) -> {
                if (row == null) {
                    committed.remove(key);
                } else {
                    committed.put(key, row);
                }
            });
        });
    }

    public void rollback() {
        staging.remove();
    }

    // ========== ReadModelStore ==========

    @Override
    public Optional<Map<String, Object>> find(String table, Map<String, Object> key) {
        Map<String, Object> row = visibleRow(table, keyOf(table, key));
        return row == null ? Optional.empty() : Optional.of(copy(row));
    }

    @Override
    public List<Map<String, Object>> findWhere(String table, String column, Object value) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : visibleRows(table).values()) {
            if (Objects.equals(row.get(column), value)) {
                result.add(copy(row));
            }
        }
        return result;
    }

    @Override
    public List<Map<String, Object>> findAll(String table) {
        return visibleRows(table).values().stream().map(InMemoryReadModelStore::copy).toList();
    }

    @Override
    public void upsert(String table, Map<String, Object> row) {
        List<Object> key = keyOf(table, row);
        Staging staged = staging.get();
        if (staged == null) {
            rows(table).compute(key, (k, existing) -> merge(existing, row));
            return;
        }
        staged.changes(table).put(key, merge(visibleRow(table, key), row));
    }

    @Override
    public void delete(String table, Map<String, Object> key) {
        List<Object> rowKey = keyOf(table, key);
        Staging staged = staging.get();
        if (staged == null) {
            rows(table).remove(rowKey);
            return;
        }
        staged.changes(table).put(rowKey, null);
    }

    @Override
    public void truncate(String table) {
        Staging staged = staging.get();
        if (staged == null) {
            rows(table).clear();
            return;
        }
        catalog.table(table);
        staged.rows.remove(table);
        staged.truncated.add(table);
    }

    @Override
    public long count(String table) {
        return staging.get() == null ? rows(table).size() : visibleRows(table).size();
    }

    private Map<String, Object> visibleRow(String table, List<Object> key) {
        Staging staged = staging.get();
        if (staged != null) {
            Map<List<Object>, Map<String, Object>> changes = staged.rows.get(table);
            if (changes != null && changes.containsKey(key)) {
                return changes.get(key);
            }
            if (staged.truncated.contains(table)) {
                return null;
            }
        }
        return rows(table).get(key);
    }

    private Map<List<Object>, Map<String, Object>> visibleRows(String table) {
        Staging staged = staging.get();
        if (staged == null) {
            return rows(table);
        }
        Map<List<Object>, Map<String, Object>> merged = new LinkedHashMap<>();
        if (!staged.truncated.contains(table)) {
            merged.putAll(rows(table));
        }
        staged.rows.getOrDefault(table, Map.of()).forEach((key, row) -> {
            if (row == null) {
                merged.remove(key);
            } else {
                merged.put(key, row);
            }
        });
        return merged;
    }

    private ConcurrentMap<List<Object>, Map<String, Object>> rows(String table) {
        catalog.table(table);
        return tables.computeIfAbsent(table, t -> new ConcurrentHashMap<>());
    }

    private Staging requireStaging() {
        Staging staged = staging.get();
        if (staged == null) {
            throw new IllegalStateException("No read model transaction open on this thread");
        }
        return staged;
    }

    private List<Object> keyOf(String table, Map<String, Object> values) {
        ReadModelTable definition = catalog.table(table);
        List<Object> key = new ArrayList<>(definition.keyColumns().size());
        for (String column : definition.keyColumns()) {
            Object value = values.get(column);
            if (value == null) {
                throw new IllegalArgumentException(
                    "Missing key column " + column + " for table " + table);
            }
            key.add(value);
        }
        return key;
    }

    private static Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> row) {
        Map<String, Object> merged = existing == null ? new HashMap<>() : copy(existing);
        merged.putAll(row);
        return merged;
    }

    private static Map<String, Object> copy(Map<String, Object> row) {
        return new HashMap<>(row);
    }

    /**
     * Writes of one open transaction. A null row marks a delete.
     */
    private static final class Staging {
        private final Map<String, Map<List<Object>, Map<String, Object>>> rows = new LinkedHashMap<>();
        private final Set<String> truncated = new LinkedHashSet<>();

        Map<List<Object>, Map<String, Object>> changes(String table) {
            return rows.computeIfAbsent(table, t -> new LinkedHashMap<>());
        }
    }
}
