package com.lifecycle.core.projection;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A read model table owned by one projector, identified by name
 * with the columns that make up its primary key.
 */
public record ReadModelTable(String name, List<String> keyColumns) {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    public ReadModelTable {
        requireIdentifier(name);
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " needs at least one key column");
        }
        keyColumns.forEach(ReadModelTable::requireIdentifier);
        keyColumns = List.copyOf(keyColumns);
    }

    public static ReadModelTable of(String name, String... keyColumns) {
        return new ReadModelTable(name, List.of(keyColumns));
    }

    /**
     * Table and column names end up in SQL text, so they are restricted
     * to lowercase identifiers.
     */
    public static String requireIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + identifier);
        }
        return identifier;
    }
}
