package com.lifecycle.core.repository;

import com.lifecycle.core.model.RebuildRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit trail of projection rebuilds.
 */
public interface RebuildAuditRepository {

    /**
     * Insert a new record or update an existing one by rebuild ID.
     */
    void save(RebuildRecord record);

    Optional<RebuildRecord> findById(UUID rebuildId);

    /**
     * Most recent rebuilds first.
     */
    List<RebuildRecord> findRecent(int limit);
}
