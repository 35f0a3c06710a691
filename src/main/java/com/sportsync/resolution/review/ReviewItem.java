package com.sportsync.resolution.review;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.RecordLimits;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A source record the engine could not resolve with confidence, waiting for a human decision.
 * Carries the record's fields and every candidate with its score so a reviewer needs nothing else.
 *
 * <p>Instances are immutable; decisions produce a new copy through the queue's compare-and-swap.</p>
 */
public class ReviewItem {

    /**
     * Prefix of the record key used for players that arrive without a source id.
     */
    public static final String NAME_KEY_PREFIX = "name:";

    private final String id;
    private final EntityKind kind;
    private final String sport;
    private final String source;
    private final String recordKey;
    private final String sourceRecordId;
    private final Map<String, Object> recordFields;
    private final List<ReviewCandidate> candidates;
    private final double bestScore;
    private final String reason;
    private final ReviewStatus status;
    private final Instant submittedAt;
    private final Instant reviewedAt;
    private final String reviewerId;
    private final String notes;
    private final String chosenCandidateId;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.sport = Objects.requireNonNull(builder.sport, "sport is required");
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.recordKey = Objects.requireNonNull(builder.recordKey, "recordKey is required");
        this.sourceRecordId = builder.sourceRecordId;
        this.recordFields = builder.recordFields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.recordFields)) : Map.of();
        this.candidates = builder.candidates != null
                ? builder.candidates.stream()
                    .sorted(Comparator.comparingDouble(ReviewCandidate::confidence).reversed())
                    .toList()
                : List.of();
        this.bestScore = this.candidates.isEmpty() ? builder.bestScore : this.candidates.get(0).confidence();
        this.reason = builder.reason;
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.reviewedAt = builder.reviewedAt;
        this.reviewerId = builder.reviewerId;
        this.notes = builder.notes;
        this.chosenCandidateId = builder.chosenCandidateId;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getSport() {
        return sport;
    }

    public String getSource() {
        return source;
    }

    /**
     * The source id, or {@code name:<alias key>} for a player that has none.
     */
    public String getRecordKey() {
        return recordKey;
    }

    public boolean isKeyedByName() {
        return recordKey.startsWith(NAME_KEY_PREFIX);
    }

    /**
     * The real source id, empty when the record was keyed by name.
     */
    public Optional<String> getSourceId() {
        return isKeyedByName() ? Optional.empty() : Optional.of(recordKey);
    }

    public String getSourceRecordId() {
        return sourceRecordId;
    }

    public Map<String, Object> getRecordFields() {
        return recordFields;
    }

    public List<ReviewCandidate> getCandidates() {
        return candidates;
    }

    public Optional<ReviewCandidate> getBestCandidate() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public Optional<ReviewCandidate> findCandidate(String canonicalId) {
        return candidates.stream().filter(c -> c.canonicalId().equals(canonicalId)).findFirst();
    }

    public double getBestScore() {
        return bestScore;
    }

    public String getReason() {
        return reason;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public String getChosenCandidateId() {
        return chosenCandidateId;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    ReviewItem decided(ReviewStatus newStatus, String reviewer, String decisionNotes, String chosenId) {
        return toBuilder()
                .status(newStatus)
                .reviewedAt(Instant.now())
                .reviewerId(reviewer)
                .notes(decisionNotes)
                .chosenCandidateId(chosenId)
                .build();
    }

    ReviewItem reopened() {
        return toBuilder()
                .status(ReviewStatus.PENDING)
                .reviewedAt(null)
                .reviewerId(null)
                .notes(null)
                .chosenCandidateId(null)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", source='" + source + '\'' +
                ", recordKey='" + recordKey + '\'' +
                ", candidates=" + candidates.size() +
                ", bestScore=" + bestScore +
                ", status=" + status +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).kind(kind).sport(sport).source(source).recordKey(recordKey)
                .sourceRecordId(sourceRecordId).recordFields(recordFields).candidates(candidates)
                .bestScore(bestScore).reason(reason).status(status).submittedAt(submittedAt)
                .reviewedAt(reviewedAt).reviewerId(reviewerId).notes(notes).chosenCandidateId(chosenCandidateId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityKind kind;
        private String sport;
        private String source;
        private String recordKey;
        private String sourceRecordId;
        private Map<String, Object> recordFields;
        private List<ReviewCandidate> candidates;
        private double bestScore;
        private String reason;
        private ReviewStatus status;
        private Instant submittedAt;
        private Instant reviewedAt;
        private String reviewerId;
        private String notes;
        private String chosenCandidateId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sport(String sport) {
            this.sport = sport;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder recordKey(String recordKey) {
            this.recordKey = recordKey;
            return this;
        }

        public Builder sourceRecordId(String sourceRecordId) {
            this.sourceRecordId = sourceRecordId;
            return this;
        }

        public Builder recordFields(Map<String, Object> recordFields) {
            this.recordFields = recordFields;
            return this;
        }

        public Builder candidates(List<ReviewCandidate> candidates) {
            this.candidates = candidates;
            return this;
        }

        /**
         * Only used when there are no candidates; otherwise the best candidate's confidence wins.
         */
        public Builder bestScore(double bestScore) {
            this.bestScore = bestScore;
            return this;
        }

        /**
         * Long reasons (they can quote raw team names) are cut to fit the stored column.
         */
        public Builder reason(String reason) {
            this.reason = RecordLimits.truncate(reason, RecordLimits.MAX_REVIEW_REASON_LENGTH);
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder reviewerId(String reviewerId) {
            this.reviewerId = reviewerId;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder chosenCandidateId(String chosenCandidateId) {
            this.chosenCandidateId = chosenCandidateId;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
