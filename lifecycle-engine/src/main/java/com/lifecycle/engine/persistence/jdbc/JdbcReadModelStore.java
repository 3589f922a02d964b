package com.lifecycle.engine.persistence.jdbc;

import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.projection.ReadModelTable;
import com.lifecycle.engine.projection.ReadModelCatalog;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of ReadModelStore.
 * Table and column names are checked against the catalog and the identifier
 * pattern before they reach SQL text; values are always bound.
 */
public class JdbcReadModelStore implements ReadModelStore {

    private final JdbcTemplate jdbcTemplate;
    private final ReadModelCatalog catalog;

    public JdbcReadModelStore(JdbcTemplate jdbcTemplate, ReadModelCatalog catalog) {
        this.jdbcTemplate = jdbcTemplate;
        this.catalog = catalog;
    }

    @Override
    public Optional<Map<String, Object>> find(String table, Map<String, Object> key) {
        ReadModelTable definition = catalog.table(table);
        List<Object> params = new ArrayList<>();
        StringJoiner where = new StringJoiner(" AND ");
        for (String column : definition.keyColumns()) {
            where.add(column + " = ?");
            params.add(bind(requireKey(table, key, column)));
        }
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT * FROM " + table + " WHERE " + where, params.toArray());
        return rows.isEmpty() ? Optional.empty() : Optional.of(new HashMap<>(rows.get(0)));
    }

    @Override
    public List<Map<String, Object>> findWhere(String table, String column, Object value) {
        catalog.table(table);
        ReadModelTable.requireIdentifier(column);
        if (value == null) {
            return copies(jdbcTemplate.queryForList(
                "SELECT * FROM " + table + " WHERE " + column + " IS NULL"));
        }
        return copies(jdbcTemplate.queryForList(
            "SELECT * FROM " + table + " WHERE " + column + " = ?", bind(value)));
    }

    @Override
    public List<Map<String, Object>> findAll(String table) {
        catalog.table(table);
        return copies(jdbcTemplate.queryForList("SELECT * FROM " + table));
    }

    @Override
    public void upsert(String table, Map<String, Object> row) {
        ReadModelTable definition = catalog.table(table);
        definition.keyColumns().forEach(column -> requireKey(table, row, column));

        List<String> columns = new ArrayList<>(new TreeSet<>(row.keySet()));
        columns.forEach(ReadModelTable::requireIdentifier);

        List<String> updates = columns.stream()
            .filter(column -> !definition.keyColumns().contains(column))
            .map(column -> column + " = EXCLUDED." + column)
            .toList();

        String sql = "INSERT INTO " + table
            + " (" + String.join(", ", columns) + ")"
            + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")"
            + " ON CONFLICT (" + String.join(", ", definition.keyColumns()) + ")"
            + (updates.isEmpty() ? " DO NOTHING" : " DO UPDATE SET " + String.join(", ", updates));

        jdbcTemplate.update(sql, columns.stream().map(column -> bind(row.get(column))).toArray());
    }

    @Override
    public void delete(String table, Map<String, Object> key) {
        ReadModelTable definition = catalog.table(table);
        List<Object> params = new ArrayList<>();
        StringJoiner where = new StringJoiner(" AND ");
        for (String column : definition.keyColumns()) {
            where.add(column + " = ?");
            params.add(bind(requireKey(table, key, column)));
        }
        jdbcTemplate.update("DELETE FROM " + table + " WHERE " + where, params.toArray());
    }

    @Override
    public void truncate(String table) {
        catalog.table(table);
        jdbcTemplate.update("DELETE FROM " + table);
    }

    @Override
    public long count(String table) {
        catalog.table(table);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0L;
    }

    private static Object requireKey(String table, Map<String, Object> values, String column) {
        Object value = values.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Missing key column " + column + " for table " + table);
        }
        return value;
    }

    private static Object bind(Object value) {
        return value instanceof Instant instant ? Timestamp.from(instant) : value;
    }

    private static List<Map<String, Object>> copies(List<Map<String, Object>> rows) {
        return rows.stream().<Map<String, Object>>map(HashMap::new).toList();
    }
}
