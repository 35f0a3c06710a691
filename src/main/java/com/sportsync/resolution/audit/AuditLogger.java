package com.sportsync.resolution.audit;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.SourceMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends audit entries for every create, update and merge decision and answers history queries.
 * Entries are written after the change they describe has committed.
 */
public class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final AuditRepository repository;

    public AuditLogger() {
        this(new InMemoryAuditRepository());
    }

    public AuditLogger(AuditRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("audit.recorded action={} kind={} entityId={} actor={}",
                entry.action(), entry.entityKind(), entry.entityId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, EntityKind kind, String entityId, String actorId,
                             Map<String, Object> previousState, Map<String, Object> newState,
                             Map<String, Object> matchDetails) {
        return record(AuditEntry.builder()
                .action(action)
                .entityKind(kind)
                .entityId(entityId)
                .actorId(actorId)
                .previousState(previousState)
                .newState(newState)
                .matchDetails(matchDetails)
                .build());
    }

    public AuditEntry created(EntityKind kind, String entityId, String actorId, Map<String, Object> newState,
                              Map<String, Object> matchDetails) {
        return record(AuditAction.ENTITY_CREATED, kind, entityId, actorId, null, newState, matchDetails);
    }

    public AuditEntry updated(EntityKind kind, String entityId, String actorId, Map<String, Object> previousState,
                              Map<String, Object> newState, Map<String, Object> matchDetails) {
        return record(AuditAction.ENTITY_UPDATED, kind, entityId, actorId, previousState, newState, matchDetails);
    }

    /**
     * Records a mapping insert ({@code previous == null}) or a mapping change.
     */
    public AuditEntry mapping(SourceMapping previous, SourceMapping current, String actorId,
                              Map<String, Object> matchDetails) {
        AuditAction action = previous == null ? AuditAction.MAPPING_CREATED : AuditAction.MAPPING_UPDATED;
        return record(action, current.kind(), current.canonicalId() != null ? current.canonicalId() : current.id(),
                actorId, previous != null ? snapshot(previous) : null, snapshot(current), matchDetails);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return repository.findByEntityId(entityId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return repository.findBetween(start, end);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }

    // ── State snapshots ───────────────────────────────────────

    public static Map<String, Object> snapshot(CanonicalGame game) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", game.id());
        state.put("sport", game.sport());
        state.put("homeTeam", game.homeTeam());
        state.put("awayTeam", game.awayTeam());
        state.put("scheduledAt", game.scheduledAt().toString());
        state.put("gameDay", game.gameDay().toString());
        state.put("primarySource", game.primarySource());
        state.put("sourceIds", game.sourceIds());
        return state;
    }

    public static Map<String, Object> snapshot(CanonicalPlayer player) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", player.id());
        state.put("sport", player.sport());
        state.put("canonicalName", player.canonicalName());
        state.put("normalizedName", player.normalizedName());
        state.put("suffix", player.suffix());
        state.put("team", player.team());
        state.put("position", player.position());
        state.put("primarySource", player.primarySource());
        state.put("sourceIds", player.sourceIds());
        return state;
    }

    public static Map<String, Object> snapshot(SourceMapping mapping) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("mappingId", mapping.id());
        state.put("source", mapping.source());
        state.put("sourceId", mapping.sourceId());
        state.put("canonicalId", mapping.canonicalId());
        state.put("confidence", mapping.confidence());
        state.put("method", mapping.method().name());
        state.put("status", mapping.status().name());
        return state;
    }
}
