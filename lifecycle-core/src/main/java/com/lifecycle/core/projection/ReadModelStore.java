package com.lifecycle.core.projection;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row access to read model tables. Rows are column-name to value maps;
 * values are strings, numbers, booleans, UUIDs, instants or null.
 */
public interface ReadModelStore {

    /**
     * Find one row by its full primary key.
     */
    Optional<Map<String, Object>> find(String table, Map<String, Object> key);

    /**
     * Rows whose column equals the given value.
     */
    List<Map<String, Object>> findWhere(String table, String column, Object value);

    /**
     * Every row of the table, in no particular order.
     */
    List<Map<String, Object>> findAll(String table);

    /**
     * Insert the row, or update the given columns of the row with the same key.
     */
    void upsert(String table, Map<String, Object> row);

    void delete(String table, Map<String, Object> key);

    /**
     * Remove every row of the table.
     */
    void truncate(String table);

    long count(String table);
}
