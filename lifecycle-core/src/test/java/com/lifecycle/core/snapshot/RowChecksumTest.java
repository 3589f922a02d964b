package com.lifecycle.core.snapshot;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RowChecksumTest {

    @Test
    void ofRows_shouldIgnoreRowOrder() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(Map.of("id", (long) i, "name", "row-" + i));
        }
        String ordered = RowChecksum.ofRows(rows);

        List<Map<String, Object>> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled);

        assertThat(RowChecksum.ofRows(shuffled)).isEqualTo(ordered);
    }

    @Test
    void ofRow_shouldIgnoreColumnOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", "x");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", "x");
        second.put("a", 1);

        assertThat(RowChecksum.ofRow(first)).isEqualTo(RowChecksum.ofRow(second));
    }

    @Test
    void ofRows_shouldDetectContentChange() {
        String before = RowChecksum.ofRows(List.of(Map.of("id", 1L, "status", "open")));
        String after = RowChecksum.ofRows(List.of(Map.of("id", 1L, "status", "closed")));

        assertThat(after).isNotEqualTo(before);
    }

    @Test
    void ofRows_shouldCountDuplicateRows() {
        Map<String, Object> row = Map.of("id", 1L);

        assertThat(RowChecksum.ofRows(List.of(row, row)))
            .isNotEqualTo(RowChecksum.ofRows(List.of(row)));
    }

    @Test
    void ofRows_emptyTableHashesEmptyString() {
        assertThat(RowChecksum.ofRows(List.of()))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void canonicalJson_shouldNormaliseNumbersAndTimestamps() {
        Instant instant = Instant.parse("2026-01-07T10:15:30Z");
        Map<String, Object> fromDriver = new HashMap<>();
        fromDriver.put("count", new BigDecimal("3.00"));
        fromDriver.put("opened_at", Timestamp.from(instant));
        fromDriver.put("note", null);

        Map<String, Object> fromMemory = new HashMap<>();
        fromMemory.put("count", 3);
        fromMemory.put("opened_at", instant);
        fromMemory.put("note", null);

        assertThat(RowChecksum.canonicalJson(fromDriver))
            .isEqualTo(RowChecksum.canonicalJson(fromMemory))
            .isEqualTo("{\"count\":\"3\",\"note\":null,\"opened_at\":\"2026-01-07T10:15:30Z\"}");
    }

    @Test
    void canonicalJson_shouldRenderUuidsAsText() {
        UUID id = UUID.fromString("6f1c1f0e-5a55-4b8c-9d5e-2b7f7e0c1a11");

        assertThat(RowChecksum.canonicalJson(Map.of("id", id, "open", true)))
            .isEqualTo("{\"id\":\"6f1c1f0e-5a55-4b8c-9d5e-2b7f7e0c1a11\",\"open\":true}");
    }
}
