package com.lifecycle.engine.projection;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Typed reads from read model rows. The JDBC store hands back driver types
 * (Timestamp, Integer vs Long) while the in-memory store returns what was
 * written, so projectors read through these helpers.
 */
public final class Rows {

    private Rows() {
    }

    public static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static long longValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number number ? number.longValue() : 0L;
    }

    public static int intValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number number ? number.intValue() : 0;
    }

    public static Integer integer(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number number ? number.intValue() : null;
    }

    public static UUID uuid(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null || value instanceof UUID) {
            return (UUID) value;
        }
        return UUID.fromString(value.toString());
    }

    public static Instant instant(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null || value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return Instant.parse(value.toString());
    }
}
