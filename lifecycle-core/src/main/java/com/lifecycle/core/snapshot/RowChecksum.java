package com.lifecycle.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Order-independent content checksum for read model tables.
 * 
 * Scheme:
 * <ol>
 *   <li>Each row is rendered as a JSON object with keys in lexicographic order.
 *       Values are canonicalised: null stays null, booleans stay booleans,
 *       numbers become plain decimal strings without trailing zeros,
 *       timestamps become ISO-8601 UTC instants, anything else uses toString().</li>
 *   <li>Each rendering is hashed with SHA-256 (lowercase hex).</li>
 *   <li>Row digests are sorted, joined with '\n' and hashed again with SHA-256.</li>
 * </ol>
 * Two tables with the same rows therefore share a checksum regardless of
 * physical row order. An empty table hashes the empty string.
 */
public final class RowChecksum {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HexFormat HEX = HexFormat.of();

    private RowChecksum() {
    }

    /**
     * Checksum of a whole table.
     */
    public static String ofRows(Collection<? extends Map<String, ?>> rows) {
        List<String> digests = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            digests.add(ofRow(row));
        }
        digests.sort(null);
        return sha256(String.join("\n", digests));
    }

    /**
     * Digest of a single row.
     */
    public static String ofRow(Map<String, ?> row) {
        return sha256(canonicalJson(row));
    }

    /**
     * Canonical JSON rendering of a row.
     */
    public static String canonicalJson(Map<String, ?> row) {
        Map<String, Object> canonical = canonicalRow(row);
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render row", e);
        }
    }

    /**
     * Row with keys sorted and values canonicalised; used for checksums and sample rows.
     */
    public static Map<String, Object> canonicalRow(Map<String, ?> row) {
        Map<String, Object> sorted = new TreeMap<>();
        row.forEach((column, value) -> sorted.put(column, canonicalValue(value)));
        return new LinkedHashMap<>(sorted);
    }

    static Object canonicalValue(Object value) {
        if (value == null || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant().toString();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant().toString();
        }
        return value.toString();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
