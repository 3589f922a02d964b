package com.lifecycle.engine.projection;

import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelTable;

import java.util.*;

/**
 * Every read model table known to the engine, with the projector that owns it.
 * Built once from the registered projectors; rejects a table claimed twice.
 */
public class ReadModelCatalog {

    private final Map<String, ReadModelTable> tables = new LinkedHashMap<>();
    private final Map<String, String> owners = new LinkedHashMap<>();

    public ReadModelCatalog(List<? extends Projector> projectors) {
        for (Projector projector : projectors) {
            for (ReadModelTable table : projector.outputs()) {
                String previousOwner = owners.putIfAbsent(table.name(), projector.name());
                if (previousOwner != null) {
                    throw new IllegalStateException(String.format(
                        "Table %s is owned by both %s and %s",
                        table.name(), previousOwner, projector.name()));
                }
                tables.put(table.name(), table);
            }
        }
    }

    public ReadModelTable table(String tableName) {
        ReadModelTable table = tables.get(tableName);
        if (table == null) {
            throw new IllegalArgumentException("Unknown read model table: " + tableName);
        }
        return table;
    }

    public boolean contains(String tableName) {
        return tables.containsKey(tableName);
    }

    public Optional<String> ownerOf(String tableName) {
        return Optional.ofNullable(owners.get(tableName));
    }

    /**
     * Table names in registration order.
     */
    public List<String> tableNames() {
        return List.copyOf(tables.keySet());
    }
}
