package com.sportsync.resolution.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only persistence for audit entries. There is deliberately no update or delete.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Entries for one canonical entity, oldest first.
     */
    List<AuditEntry> findByEntityId(String entityId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * The most recent entries, newest last, up to {@code limit}.
     */
    List<AuditEntry> findRecent(int limit);
}
