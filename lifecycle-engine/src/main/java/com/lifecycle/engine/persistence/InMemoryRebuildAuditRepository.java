package com.lifecycle.engine.persistence;

import com.lifecycle.core.model.RebuildRecord;
import com.lifecycle.core.repository.RebuildAuditRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of RebuildAuditRepository.
 */
public class InMemoryRebuildAuditRepository implements RebuildAuditRepository {

    private final Map<UUID, RebuildRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(RebuildRecord record) {
        records.put(record.rebuildId(), record);
    }

    @Override
    public Optional<RebuildRecord> findById(UUID rebuildId) {
        return Optional.ofNullable(records.get(rebuildId));
    }

    @Override
    public List<RebuildRecord> findRecent(int limit) {
        return records.values().stream()
            .sorted(Comparator.comparing(RebuildRecord::startedAt).reversed())
            .limit(limit)
            .toList();
    }
}
