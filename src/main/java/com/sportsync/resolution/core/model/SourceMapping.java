package com.sportsync.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Link from one source's id to a canonical entity.
 * {@code canonicalId} is null while the mapping is in manual review or explicitly unmatched.
 */
public record SourceMapping(
        String id,
        EntityKind kind,
        String sport,
        String source,
        String sourceId,
        String canonicalId,
        double confidence,
        MatchMethod method,
        MappingStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    public SourceMapping {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(sport, "sport is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(status, "status is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        if (status == MappingStatus.MATCHED && canonicalId == null) {
            throw new IllegalArgumentException("matched mapping requires a canonicalId");
        }
        createdAt = createdAt != null ? createdAt : Instant.now();
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    public static SourceMapping matched(EntityKind kind, String sport, String source, String sourceId,
                                        String canonicalId, double confidence, MatchMethod method) {
        return new SourceMapping(UUID.randomUUID().toString(), kind, sport, source, sourceId, canonicalId,
                confidence, method, MappingStatus.MATCHED, null, null);
    }

    public static SourceMapping inReview(EntityKind kind, String sport, String source, String sourceId,
                                         double bestConfidence) {
        return new SourceMapping(UUID.randomUUID().toString(), kind, sport, source, sourceId, null,
                bestConfidence, MatchMethod.NONE, MappingStatus.MANUAL_REVIEW, null, null);
    }

    public SourceMapping resolvedTo(String newCanonicalId, double newConfidence, MatchMethod newMethod) {
        return new SourceMapping(id, kind, sport, source, sourceId, newCanonicalId, newConfidence, newMethod,
                MappingStatus.MATCHED, createdAt, Instant.now());
    }

    public SourceMapping awaitingReview(double bestConfidence) {
        return new SourceMapping(id, kind, sport, source, sourceId, null, bestConfidence, MatchMethod.NONE,
                MappingStatus.MANUAL_REVIEW, createdAt, Instant.now());
    }

    public SourceMapping markedUnmatched() {
        return new SourceMapping(id, kind, sport, source, sourceId, null, confidence, MatchMethod.NONE,
                MappingStatus.FAILED, createdAt, Instant.now());
    }

    public SourceMapping repointedTo(String survivorId) {
        return new SourceMapping(id, kind, sport, source, sourceId, survivorId, confidence, method,
                status, createdAt, Instant.now());
    }

    public boolean isMatched() {
        return status == MappingStatus.MATCHED;
    }
}
