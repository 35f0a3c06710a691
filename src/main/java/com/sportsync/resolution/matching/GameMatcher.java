package com.sportsync.resolution.matching;

import com.sportsync.resolution.api.MatchingOptions;
import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.audit.AuditLogger;
import com.sportsync.resolution.core.ValidationException;
import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.GameKey;
import com.sportsync.resolution.core.model.GameObservation;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.logging.LogContext;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.normalize.NameNormalizer;
import com.sportsync.resolution.review.ReviewDecisionHandler;
import com.sportsync.resolution.review.ReviewItem;
import com.sportsync.resolution.review.ReviewService;
import com.sportsync.resolution.scoring.ConfidenceScore;
import com.sportsync.resolution.scoring.ConfidenceScorer;
import com.sportsync.resolution.scoring.ConfidenceTier;
import com.sportsync.resolution.scoring.MatchSignals;
import com.sportsync.resolution.similarity.EditDistance;
import com.sportsync.resolution.similarity.SimilarityAlgorithm;
import com.sportsync.resolution.store.CanonicalStore;
import com.sportsync.resolution.store.ConflictException;
import com.sportsync.resolution.team.TeamMappingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves game records to canonical games.
 *
 * <p>Pipeline, first hit wins: exact source id, team codes within the start-time tolerance,
 * fuzzy team names on the same game day, then scoring against nearby games. Anything short of a
 * confident match goes to the review queue; a miss with both teams known creates a new game.</p>
 *
 * <p>Every insert is assumed to race with other writers. A natural-key or source-id conflict is
 * answered by re-reading the winning row and linking to it.</p>
 */
public class GameMatcher implements ReviewDecisionHandler {
    private static final Logger log = LoggerFactory.getLogger(GameMatcher.class);

    private static final Duration UPDATE_MIN_SHIFT = Duration.ofMinutes(1);

    private final CanonicalStore store;
    private final TeamMappingRegistry teams;
    private final NameNormalizer normalizer;
    private final SimilarityAlgorithm nameSimilarity;
    private final ConfidenceScorer scorer;
    private final MatchingOptions options;
    private final ReviewService reviewService;
    private final AuditLogger auditLogger;
    private final MetricsService metricsService;

    public GameMatcher(CanonicalStore store, TeamMappingRegistry teams, NameNormalizer normalizer,
                       SimilarityAlgorithm nameSimilarity, MatchingOptions options, ReviewService reviewService,
                       AuditLogger auditLogger, MetricsService metricsService) {
        this.store = store;
        this.teams = teams;
        this.normalizer = normalizer;
        this.nameSimilarity = nameSimilarity;
        this.scorer = options.scorer();
        this.options = options;
        this.reviewService = reviewService;
        this.auditLogger = auditLogger;
        this.metricsService = metricsService;
    }

    /**
     * Resolves a game record.
     *
     * @throws ValidationException if the record is malformed
     */
    public ResolutionResult resolve(SourceRecord record) {
        GameObservation game = GameObservation.from(record);
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forResolution(LogContext.generateCorrelationId(), EntityKind.GAME,
                game.source(), game.sourceId())) {
            ResolutionResult result = resolveObservation(game);
            metricsService.recordResolution(EntityKind.GAME, result.status(), result.method(),
                    Duration.ofNanos(System.nanoTime() - start));
            log.info("game.resolved sport={} source={} sourceId={} canonicalId={} status={} method={} confidence={}",
                    game.sport(), game.source(), game.sourceId(), result.canonicalId(), result.status(),
                    result.method(), result.confidence());
            return result;
        }
    }

    private ResolutionResult resolveObservation(GameObservation game) {
        // Step 1: exact source id
        Optional<SourceMapping> existing = store.findMapping(EntityKind.GAME, game.sport(), game.source(),
                game.sourceId());
        if (existing.isPresent()) {
            Optional<ResolutionResult> known = fromExistingMapping(game, existing.get());
            if (known.isPresent()) {
                return known.get();
            }
        }
        SourceMapping mapping = existing.orElse(null);

        Optional<String> home = teams.resolve(game.sport(), game.source(), game.homeTeam(), game.homeTeamId());
        Optional<String> away = teams.resolve(game.sport(), game.source(), game.awayTeam(), game.awayTeamId());
        if (home.isPresent() && home.equals(away)) {
            throw new ValidationException(SourceRecord.AWAY_TEAM, "resolves to the home team " + home.get());
        }
        LocalDate gameDay = options.gameDay(game.sport(), game.scheduledAt());
        Duration tolerance = options.toleranceFor(game.source());

        // Step 2: both teams known and start time within tolerance
        if (home.isPresent() && away.isPresent()) {
            Optional<CanonicalGame> windowMatch = findInTimeWindow(game, home.get(), away.get(), tolerance);
            if (windowMatch.isPresent()) {
                return decide(game, mapping, windowMatch.get(), options.getTimeWindowConfidence(),
                        MatchMethod.TIME_WINDOW);
            }
        }

        // Step 3: fuzzy team names on the same game day, only when unambiguous
        List<CanonicalGame> sameDay = store.findGamesOnDay(game.sport(), gameDay).stream()
                .filter(candidate -> isLinkable(candidate, game))
                .toList();
        List<CanonicalGame> fuzzy = sameDay.stream().filter(candidate -> teamNamesClose(game, candidate)).toList();
        if (fuzzy.size() == 1) {
            return decide(game, mapping, fuzzy.get(0), options.getFuzzyTeamConfidence(), MatchMethod.FUZZY_TEAM_NAME);
        }

        // Step 4: score everything nearby; anything plausible is left to a reviewer
        List<ScoredCandidate> scored = scoreCandidates(game, home.orElse(null), away.orElse(null), sameDay, tolerance);
        List<ScoredCandidate> plausible = scored.stream().filter(c -> c.score().clearsReview()).toList();
        if (!plausible.isEmpty()) {
            return review(game, mapping, plausible, "no confident match among " + plausible.size() + " candidates");
        }
        if (home.isEmpty() || away.isEmpty()) {
            return review(game, mapping, List.of(), "team not recognized: "
                    + (home.isEmpty() ? game.homeTeam() : game.awayTeam()));
        }
        return create(game, mapping, home.get(), away.get(), gameDay, MatchMethod.CREATED, options.getSystemActor());
    }

    /**
     * Outcome of a stored mapping, or empty when the pipeline has to run again
     * (a pending mapping, or a review mapping whose item is missing).
     */
    private Optional<ResolutionResult> fromExistingMapping(GameObservation game, SourceMapping mapping) {
        if (mapping.status() == MappingStatus.MATCHED) {
            String canonicalId = store.resolveSurvivor(EntityKind.GAME, mapping.canonicalId());
            store.findGame(canonicalId).ifPresent(current -> maybeUpdate(current, game, options.getSystemActor()));
            return Optional.of(ResolutionResult.matched(canonicalId, 1.0, MatchMethod.EXACT_ID));
        }
        if (mapping.status() == MappingStatus.FAILED) {
            return Optional.of(ResolutionResult.unmatched(mapping.confidence()));
        }
        if (mapping.status() == MappingStatus.MANUAL_REVIEW) {
            return reviewService.getReviewQueue()
                    .findByRecord(EntityKind.GAME, game.sport(), game.source(), game.sourceId())
                    .map(item -> ResolutionResult.manualReview(item.getId(), item.getBestScore()));
        }
        return Optional.empty();
    }

    private Optional<CanonicalGame> findInTimeWindow(GameObservation game, String home, String away,
                                                     Duration tolerance) {
        Instant at = game.scheduledAt();
        return store.findGamesBetween(game.sport(), at.minus(tolerance), at.plus(tolerance)).stream()
                .filter(candidate -> candidate.homeTeam().equals(home) && candidate.awayTeam().equals(away))
                .filter(candidate -> isLinkable(candidate, game))
                .min(Comparator.comparing((CanonicalGame candidate) -> offset(candidate, at))
                        .thenComparing(CanonicalGame::createdAt));
    }

    private boolean teamNamesClose(GameObservation game, CanonicalGame candidate) {
        return nameClose(game.sport(), game.homeTeam(), candidate.homeTeam())
                && nameClose(game.sport(), game.awayTeam(), candidate.awayTeam());
    }

    private boolean nameClose(String sport, String rawName, String code) {
        String normalized = normalizer.normalizeTeam(rawName);
        if (normalized.isEmpty()) {
            return false;
        }
        for (String known : teams.knownNames(sport, code)) {
            if (EditDistance.within(normalized, known, options.getMaxTeamEditDistance())) {
                return true;
            }
        }
        return false;
    }

    private List<ScoredCandidate> scoreCandidates(GameObservation game, String home, String away,
                                                  List<CanonicalGame> sameDay, Duration tolerance) {
        Map<String, CanonicalGame> pool = new LinkedHashMap<>();
        sameDay.forEach(candidate -> pool.put(candidate.id(), candidate));
        Duration wide = tolerance.multipliedBy(2);
        store.findGamesBetween(game.sport(), game.scheduledAt().minus(wide), game.scheduledAt().plus(wide)).stream()
                .filter(candidate -> isLinkable(candidate, game))
                .forEach(candidate -> pool.putIfAbsent(candidate.id(), candidate));

        List<ScoredCandidate> scored = new ArrayList<>();
        for (CanonicalGame candidate : pool.values()) {
            double proximity = Math.max(0.0,
                    1.0 - (double) offset(candidate, game.scheduledAt()).toMillis() / wide.toMillis());
            Boolean teamMatch = home != null && away != null
                    ? home.equals(candidate.homeTeam()) && away.equals(candidate.awayTeam())
                    : null;
            double similarity = (bestSimilarity(game.sport(), game.homeTeam(), candidate.homeTeam())
                    + bestSimilarity(game.sport(), game.awayTeam(), candidate.awayTeam())) / 2.0;
            ConfidenceScore score = scorer.score(EntityKind.GAME, MatchSignals.builder()
                    .nameSimilarity(similarity)
                    .teamMatch(teamMatch)
                    .timeProximity(proximity)
                    .build());
            metricsService.recordCandidateScore(EntityKind.GAME, score.confidence());
            log.debug("game.candidate canonicalId={} confidence={} tier={}",
                    candidate.id(), score.confidence(), score.tier());
            scored.add(new ScoredCandidate(candidate.id(), label(candidate), score));
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::confidence).reversed());
        return scored;
    }

    private double bestSimilarity(String sport, String rawName, String code) {
        String normalized = normalizer.normalizeTeam(rawName);
        double best = 0.0;
        for (String known : teams.knownNames(sport, code)) {
            best = Math.max(best, nameSimilarity.compute(normalized, known));
        }
        return best;
    }

    /**
     * Applies the tier of a fixed step confidence: link when it auto-accepts, otherwise queue.
     */
    private ResolutionResult decide(GameObservation game, SourceMapping mapping, CanonicalGame target,
                                    double confidence, MatchMethod method) {
        ConfidenceTier tier = scorer.profile(EntityKind.GAME).tierOf(confidence);
        if (tier == ConfidenceTier.AUTO_ACCEPT) {
            return link(game, mapping, target, confidence, method, options.getSystemActor(), false);
        }
        ScoredCandidate candidate = new ScoredCandidate(target.id(), label(target),
                new ConfidenceScore(confidence, tier, MatchSignals.builder().build()));
        return review(game, mapping, List.of(candidate), method.getDescription() + " below auto-accept");
    }

    private ResolutionResult link(GameObservation game, SourceMapping previous, CanonicalGame target,
                                  double confidence, MatchMethod method, String actorId, boolean manual) {
        SourceMapping linked = previous != null
                ? previous.resolvedTo(target.id(), confidence, method)
                : SourceMapping.matched(EntityKind.GAME, game.sport(), game.source(), game.sourceId(),
                target.id(), confidence, method);
        try {
            store.saveMapping(linked);
        } catch (ConflictException e) {
            if (manual) {
                throw e;
            }
            if (e.isSourceId()) {
                log.warn("game.mapping_conflict source={} sourceId={} constraint={}",
                        game.source(), game.sourceId(), e.getConstraint());
                return rereadMapping(game, e);
            }
            if (e.isCanonicalSource()) {
                log.warn("game.source_already_linked canonicalId={} source={}", target.id(), game.source());
                ScoredCandidate candidate = new ScoredCandidate(target.id(), label(target),
                        new ConfidenceScore(confidence, ConfidenceTier.MANUAL_REVIEW, MatchSignals.builder().build()));
                return review(game, previous, List.of(candidate), "game already linked to another id from "
                        + game.source());
            }
            throw e;
        }
        auditLogger.mapping(previous, linked, actorId, matchDetails(game, method, confidence));
        maybeUpdate(target, game, actorId);
        return manual ? ResolutionResult.approved(target.id(), false)
                : ResolutionResult.matched(target.id(), confidence, method);
    }

    private ResolutionResult create(GameObservation game, SourceMapping previous, String home, String away,
                                    LocalDate gameDay, MatchMethod method, String actorId) {
        CanonicalGame created = CanonicalGame.builder()
                .sport(game.sport())
                .homeTeam(home)
                .awayTeam(away)
                .scheduledAt(game.scheduledAt())
                .gameDay(gameDay)
                .primarySource(game.source())
                .build();
        SourceMapping mapping = previous != null
                ? previous.resolvedTo(created.id(), 1.0, method)
                : SourceMapping.matched(EntityKind.GAME, game.sport(), game.source(), game.sourceId(),
                created.id(), 1.0, method);
        boolean manual = method == MatchMethod.MANUAL;
        try {
            store.createGame(created, mapping);
        } catch (ConflictException e) {
            if (e.isNaturalKey()) {
                GameKey key = created.naturalKey();
                CanonicalGame winner = store.findGameByKey(key).orElseThrow(() -> e);
                log.info("game.natural_key_conflict key={} canonicalId={}", key, winner.id());
                return link(game, previous, winner, 1.0, manual ? MatchMethod.MANUAL : MatchMethod.NATURAL_KEY,
                        actorId, manual);
            }
            if (e.isSourceId() && !manual) {
                log.warn("game.mapping_conflict source={} sourceId={} constraint={}",
                        game.source(), game.sourceId(), e.getConstraint());
                return rereadMapping(game, e);
            }
            throw e;
        }

        Map<String, Object> details = matchDetails(game, method, 1.0);
        CanonicalGame stored = created.withSourceIds(Map.of(game.source(), game.sourceId()));
        auditLogger.created(EntityKind.GAME, created.id(), actorId, AuditLogger.snapshot(stored), details);
        auditLogger.mapping(previous, mapping, actorId, details);
        metricsService.incrementEntityCreated(EntityKind.GAME);
        log.info("game.created canonicalId={} key={} source={}", created.id(), created.naturalKey(), game.source());
        return manual ? ResolutionResult.approved(created.id(), true) : ResolutionResult.created(created.id());
    }

    private ResolutionResult rereadMapping(GameObservation game, ConflictException conflict) {
        SourceMapping winner = store.findMapping(EntityKind.GAME, game.sport(), game.source(), game.sourceId())
                .orElseThrow(() -> conflict);
        return fromExistingMapping(game, winner).orElseThrow(() -> conflict);
    }

    private ResolutionResult review(GameObservation game, SourceMapping previous, List<ScoredCandidate> candidates,
                                    String reason) {
        double best = candidates.isEmpty() ? 0.0 : candidates.get(0).confidence();
        if (previous == null) {
            SourceMapping inReview = SourceMapping.inReview(EntityKind.GAME, game.sport(), game.source(),
                    game.sourceId(), best);
            try {
                store.saveMapping(inReview);
                auditLogger.mapping(null, inReview, options.getSystemActor(), Map.of("reason", reason));
            } catch (ConflictException e) {
                if (!e.isSourceId()) {
                    throw e;
                }
                SourceMapping winner = store.findMapping(EntityKind.GAME, game.sport(), game.source(),
                        game.sourceId()).orElseThrow(() -> e);
                Optional<ResolutionResult> known = fromExistingMapping(game, winner);
                if (known.isPresent()) {
                    return known.get();
                }
            }
        } else if (previous.status() != MappingStatus.MANUAL_REVIEW) {
            SourceMapping inReview = store.saveMapping(previous.awaitingReview(best));
            auditLogger.mapping(previous, inReview, options.getSystemActor(), Map.of("reason", reason));
        }

        ReviewItem item = reviewService.submitForReview(ReviewItem.builder()
                .kind(EntityKind.GAME)
                .sport(game.sport())
                .source(game.source())
                .recordKey(game.sourceId())
                .sourceRecordId(game.raw().id())
                .recordFields(game.raw().fields())
                .candidates(candidates.stream().map(ScoredCandidate::toReviewCandidate).toList())
                .bestScore(best)
                .reason(reason)
                .build());
        log.info("game.queued_for_review source={} sourceId={} reviewItemId={} reason={}",
                game.source(), game.sourceId(), item.getId(), reason);
        return ResolutionResult.manualReview(item.getId(), item.getBestScore());
    }

    /**
     * A source with higher authority than the game's primary source corrects the start time,
     * as long as the game stays on the same game day.
     */
    private void maybeUpdate(CanonicalGame current, GameObservation game, String actorId) {
        int incoming = options.sourceProfile(game.source()).authority();
        int primary = current.primarySource() != null
                ? options.sourceProfile(current.primarySource()).authority() : Integer.MIN_VALUE;
        if (incoming <= primary || offset(current, game.scheduledAt()).compareTo(UPDATE_MIN_SHIFT) <= 0) {
            return;
        }
        if (!options.gameDay(game.sport(), game.scheduledAt()).equals(current.gameDay())) {
            log.debug("game.update_skipped canonicalId={} reason=game_day_change", current.id());
            return;
        }
        CanonicalGame updated = current.toBuilder()
                .scheduledAt(game.scheduledAt())
                .primarySource(game.source())
                .updatedAt(Instant.now())
                .build();
        store.updateGame(updated);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", game.source());
        details.put("sourceRecordId", game.raw().id());
        details.put("reason", "higher authority start time");
        auditLogger.updated(EntityKind.GAME, current.id(), actorId, AuditLogger.snapshot(current),
                AuditLogger.snapshot(updated), details);
        log.info("game.updated canonicalId={} scheduledAt={} primarySource={}",
                current.id(), updated.scheduledAt(), updated.primarySource());
    }

    // ── Review decisions ──────────────────────────────────────

    @Override
    public ResolutionResult applyApproval(ReviewItem item, String candidateId, String reviewerId) {
        GameObservation game = GameObservation.from(rebuild(item));
        SourceMapping previous = store.findMapping(EntityKind.GAME, game.sport(), game.source(), game.sourceId())
                .orElse(null);
        if (candidateId != null) {
            String targetId = store.resolveSurvivor(EntityKind.GAME, candidateId);
            CanonicalGame target = store.findGame(targetId)
                    .orElseThrow(() -> new IllegalArgumentException("Game not found: " + candidateId));
            return link(game, previous, target, 1.0, MatchMethod.MANUAL, reviewerId, true);
        }
        String home = teams.resolve(game.sport(), game.source(), game.homeTeam(), game.homeTeamId())
                .orElseThrow(() -> new ValidationException(SourceRecord.HOME_TEAM,
                        "cannot create a game for unknown team " + game.homeTeam()));
        String away = teams.resolve(game.sport(), game.source(), game.awayTeam(), game.awayTeamId())
                .orElseThrow(() -> new ValidationException(SourceRecord.AWAY_TEAM,
                        "cannot create a game for unknown team " + game.awayTeam()));
        return create(game, previous, home, away, options.gameDay(game.sport(), game.scheduledAt()),
                MatchMethod.MANUAL, reviewerId);
    }

    @Override
    public void applyRejection(ReviewItem item, String reviewerId) {
        Optional<SourceMapping> previous = store.findMapping(EntityKind.GAME, item.getSport(), item.getSource(),
                item.getRecordKey());
        SourceMapping unmatched = previous
                .map(SourceMapping::markedUnmatched)
                .orElseGet(() -> SourceMapping.inReview(EntityKind.GAME, item.getSport(), item.getSource(),
                        item.getRecordKey(), item.getBestScore()).markedUnmatched());
        store.saveMapping(unmatched);
        auditLogger.mapping(previous.orElse(null), unmatched, reviewerId, Map.of("reviewItemId", item.getId()));
    }

    static SourceRecord rebuild(ReviewItem item) {
        return SourceRecord.builder()
                .id(item.getSourceRecordId())
                .kind(item.getKind())
                .sport(item.getSport())
                .source(item.getSource())
                .sourceId(item.getSourceId().orElse(null))
                .fields(item.getRecordFields())
                .build();
    }

    private boolean isLinkable(CanonicalGame candidate, GameObservation game) {
        String linkedId = candidate.sourceIds().get(game.source());
        return linkedId == null || linkedId.equals(game.sourceId());
    }

    private static Duration offset(CanonicalGame candidate, Instant at) {
        return Duration.between(candidate.scheduledAt(), at).abs();
    }

    private static String label(CanonicalGame game) {
        return game.awayTeam() + " @ " + game.homeTeam() + " " + game.scheduledAt();
    }

    private Map<String, Object> matchDetails(GameObservation game, MatchMethod method, double confidence) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", method.name());
        details.put("description", method.getDescription());
        details.put("confidence", confidence);
        details.put("source", game.source());
        details.put("sourceId", game.sourceId());
        details.put("sourceRecordId", game.raw().id());
        return details;
    }
}
