package com.sportsync.resolution.review;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sportsync.resolution.api.Page;
import com.sportsync.resolution.api.PageRequest;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.store.ConflictException;
import com.sportsync.resolution.store.JsonCodec;
import com.sportsync.resolution.store.SqlExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * {@link ReviewQueue} over the {@code review_items} table. The compare-and-swap is a conditional
 * {@code UPDATE ... WHERE status = ?}; the one-item-per-record rule is a unique constraint.
 */
public class JdbcReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcReviewQueue.class);

    private static final TypeReference<List<ReviewCandidate>> CANDIDATES = new TypeReference<>() {
    };

    private static final String COLUMNS = "id, entity_kind, sport, source, source_id, source_record_id,"
            + " record_fields, candidates, best_score, reason, status, submitted_at, reviewed_at, reviewer_id,"
            + " notes, chosen_candidate_id";
    private static final String SELECT = "SELECT " + COLUMNS + " FROM review_items";

    private final SqlExecutor sql;
    private final JsonCodec json;

    public JdbcReviewQueue(SqlExecutor sql, JsonCodec json) {
        this.sql = sql;
        this.json = json;
    }

    @Override
    public ReviewItem submit(ReviewItem item) {
        try {
            sql.update("INSERT INTO review_items (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    item.getId(), item.getKind(), item.getSport(), item.getSource(), item.getRecordKey(),
                    item.getSourceRecordId(), json.write(item.getRecordFields()), json.write(item.getCandidates()),
                    item.getBestScore(), item.getReason(), item.getStatus(), item.getSubmittedAt(),
                    item.getReviewedAt(), item.getReviewerId(), item.getNotes(), item.getChosenCandidateId());
            log.debug("review.queued reviewItemId={} kind={} recordKey={} bestScore={}",
                    item.getId(), item.getKind(), item.getRecordKey(), item.getBestScore());
            return item;
        } catch (ConflictException e) {
            log.debug("review.duplicate kind={} recordKey={}", item.getKind(), item.getRecordKey());
            return findByRecord(item.getKind(), item.getSport(), item.getSource(), item.getRecordKey())
                    .orElseThrow(() -> e);
        }
    }

    @Override
    public ReviewItem get(String reviewId) {
        return sql.queryOne(SELECT + " WHERE id = ?", this::map, reviewId).orElse(null);
    }

    @Override
    public Optional<ReviewItem> findByRecord(EntityKind kind, String sport, String source, String recordKey) {
        return sql.queryOne(SELECT + " WHERE entity_kind = ? AND sport = ? AND source = ? AND source_id = ?",
                this::map, kind, sport, source, recordKey);
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        long total = countWhere("status = 'PENDING'");
        List<ReviewItem> content = sql.query(SELECT + " WHERE status = 'PENDING'"
                + " ORDER BY submitted_at, id LIMIT ? OFFSET ?", this::map, page.limit(), page.offset());
        return new Page<>(content, total, page.pageNumber(), page.limit());
    }

    @Override
    public Page<ReviewItem> getPendingByKind(EntityKind kind, PageRequest page) {
        long total = countWhere("status = 'PENDING' AND entity_kind = ?", kind);
        List<ReviewItem> content = sql.query(SELECT + " WHERE status = 'PENDING' AND entity_kind = ?"
                + " ORDER BY submitted_at, id LIMIT ? OFFSET ?", this::map, kind, page.limit(), page.offset());
        return new Page<>(content, total, page.pageNumber(), page.limit());
    }

    @Override
    public ReviewItem compareAndSet(String reviewId, ReviewStatus expected, ReviewItem decided) {
        int rows = sql.update("UPDATE review_items SET status = ?, reviewed_at = ?, reviewer_id = ?, notes = ?,"
                        + " chosen_candidate_id = ? WHERE id = ? AND status = ?",
                decided.getStatus(), decided.getReviewedAt(), decided.getReviewerId(), decided.getNotes(),
                decided.getChosenCandidateId(), reviewId, expected);
        if (rows == 0) {
            ReviewItem current = get(reviewId);
            if (current == null) {
                throw new IllegalArgumentException("Review item not found: " + reviewId);
            }
            throw new ReviewConflictException(reviewId, current.getStatus());
        }
        return get(reviewId);
    }

    @Override
    public long countPending() {
        return countWhere("status = 'PENDING'");
    }

    private long countWhere(String condition, Object... params) {
        return sql.queryOne("SELECT COUNT(*) AS n FROM review_items WHERE " + condition,
                rs -> rs.getLong("n"), params).orElse(0L);
    }

    private ReviewItem map(ResultSet rs) throws SQLException {
        return ReviewItem.builder()
                .id(rs.getString("id"))
                .kind(EntityKind.valueOf(rs.getString("entity_kind")))
                .sport(rs.getString("sport"))
                .source(rs.getString("source"))
                .recordKey(rs.getString("source_id"))
                .sourceRecordId(rs.getString("source_record_id"))
                .recordFields(json.readMap(rs.getString("record_fields")))
                .candidates(json.read(rs.getString("candidates"), CANDIDATES))
                .bestScore(rs.getDouble("best_score"))
                .reason(rs.getString("reason"))
                .status(ReviewStatus.valueOf(rs.getString("status")))
                .submittedAt(SqlExecutor.instant(rs, "submitted_at"))
                .reviewedAt(SqlExecutor.instant(rs, "reviewed_at"))
                .reviewerId(rs.getString("reviewer_id"))
                .notes(rs.getString("notes"))
                .chosenCandidateId(rs.getString("chosen_candidate_id"))
                .build();
    }
}
