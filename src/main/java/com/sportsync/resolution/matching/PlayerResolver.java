package com.sportsync.resolution.matching;

import com.sportsync.resolution.api.MatchingOptions;
import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.audit.AuditAction;
import com.sportsync.resolution.audit.AuditLogger;
import com.sportsync.resolution.core.ValidationException;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.PlayerAlias;
import com.sportsync.resolution.core.model.PlayerContext;
import com.sportsync.resolution.core.model.PlayerObservation;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.logging.LogContext;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.normalize.GenerationalSuffix;
import com.sportsync.resolution.normalize.NameNormalizer;
import com.sportsync.resolution.normalize.NormalizedName;
import com.sportsync.resolution.review.ReviewDecisionHandler;
import com.sportsync.resolution.review.ReviewItem;
import com.sportsync.resolution.review.ReviewService;
import com.sportsync.resolution.review.ReviewStatus;
import com.sportsync.resolution.scoring.ConfidenceScore;
import com.sportsync.resolution.scoring.ConfidenceScorer;
import com.sportsync.resolution.scoring.ConfidenceTier;
import com.sportsync.resolution.scoring.MatchSignals;
import com.sportsync.resolution.similarity.SimilarityAlgorithm;
import com.sportsync.resolution.store.CanonicalStore;
import com.sportsync.resolution.store.ConflictException;
import com.sportsync.resolution.team.TeamMappingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves player records to canonical players.
 *
 * <p>Pipeline, first hit wins: exact source id, known alias for the source, normalized name plus
 * team, then fuzzy names on the same team. Candidates whose generational suffix conflicts with the
 * input's are removed before scoring, so a father and son are never auto-matched. Only sources
 * allowed to create players may create one on a miss; every other miss is queued for review.</p>
 *
 * <p>Records without a source id are tracked by their alias key instead: they get no mapping row
 * and their review item is keyed {@code name:<alias key>}.</p>
 */
public class PlayerResolver implements ReviewDecisionHandler {
    private static final Logger log = LoggerFactory.getLogger(PlayerResolver.class);

    private final CanonicalStore store;
    private final TeamMappingRegistry teams;
    private final NameNormalizer normalizer;
    private final SimilarityAlgorithm nameSimilarity;
    private final ConfidenceScorer scorer;
    private final MatchingOptions options;
    private final ReviewService reviewService;
    private final AuditLogger auditLogger;
    private final MetricsService metricsService;

    public PlayerResolver(CanonicalStore store, TeamMappingRegistry teams, NameNormalizer normalizer,
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
     * Resolves a player record using team and position hints from the surrounding game record.
     *
     * @throws ValidationException if the record is malformed
     */
    public ResolutionResult resolve(SourceRecord record, PlayerContext context) {
        Observed player = observe(PlayerObservation.from(record, context));
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forResolution(LogContext.generateCorrelationId(), EntityKind.PLAYER,
                player.source(), player.recordKey())) {
            ResolutionResult result = resolveObserved(player);
            metricsService.recordResolution(EntityKind.PLAYER, result.status(), result.method(),
                    Duration.ofNanos(System.nanoTime() - start));
            log.info("player.resolved sport={} source={} recordKey={} canonicalId={} status={} method={} confidence={}",
                    player.sport(), player.source(), player.recordKey(), result.canonicalId(), result.status(),
                    result.method(), result.confidence());
            return result;
        }
    }

    private ResolutionResult resolveObserved(Observed player) {
        // Step 1: exact source id
        SourceMapping mapping = null;
        if (player.obs().hasSourceId()) {
            Optional<SourceMapping> existing = store.findMapping(EntityKind.PLAYER, player.sport(), player.source(),
                    player.obs().sourceId());
            if (existing.isPresent()) {
                Optional<ResolutionResult> known = fromExistingMapping(player, existing.get());
                if (known.isPresent()) {
                    return known.get();
                }
                mapping = existing.get();
            }
        }

        // Step 2: alias already recorded for this source
        Optional<PlayerAlias> alias = store.findAlias(player.sport(), player.name().key(), player.source());
        if (alias.isPresent()) {
            String canonicalId = store.resolveSurvivor(EntityKind.PLAYER, alias.get().canonicalId());
            Optional<CanonicalPlayer> target = store.findPlayer(canonicalId);
            if (target.isPresent()) {
                return link(player, mapping, target.get(), alias.get().confidence(), MatchMethod.ALIAS,
                        options.getSystemActor(), false);
            }
        }

        if (!player.obs().hasSourceId()) {
            Optional<ReviewItem> earlier = reviewService.getReviewQueue()
                    .findByRecord(EntityKind.PLAYER, player.sport(), player.source(), player.recordKey());
            if (earlier.isPresent() && earlier.get().getStatus() == ReviewStatus.REJECTED) {
                return ResolutionResult.unmatched(earlier.get().getBestScore());
            }
            if (earlier.isPresent() && earlier.get().isPending()) {
                return ResolutionResult.manualReview(earlier.get().getId(), earlier.get().getBestScore());
            }
        }

        // Step 3: normalized name and team
        if (player.team() != null) {
            List<CanonicalPlayer> exact = store.findPlayersByName(player.sport(), player.name().value()).stream()
                    .filter(candidate -> player.team().equals(candidate.team()))
                    .filter(candidate -> isLinkable(candidate, player))
                    .filter(candidate -> !suffixConflict(candidate, player))
                    .toList();
            if (exact.size() == 1) {
                return decide(player, mapping, exact.get(0), options.getNameAndTeamConfidence(),
                        MatchMethod.NAME_AND_TEAM);
            }
        }

        // Step 4: fuzzy names restricted to the same team
        List<ScoredCandidate> scored = scoreCandidates(player);
        List<ScoredCandidate> plausible = scored.stream().filter(c -> c.score().clearsReview()).toList();
        List<ScoredCandidate> confident = plausible.stream().filter(c -> c.score().isAutoAccept()).toList();
        if (confident.size() == 1) {
            ScoredCandidate best = confident.get(0);
            Optional<CanonicalPlayer> target = store.findPlayer(best.canonicalId());
            if (target.isPresent()) {
                return link(player, mapping, target.get(), best.confidence(), MatchMethod.FUZZY_NAME,
                        options.getSystemActor(), false);
            }
        }

        // Step 5: review, or create when the source may
        if (!plausible.isEmpty()) {
            return review(player, mapping, plausible, confident.size() > 1
                    ? confident.size() + " candidates above auto-accept"
                    : "no confident match among " + plausible.size() + " candidates");
        }
        if (!options.sourceProfile(player.source()).createsPlayers()) {
            return review(player, mapping, List.of(), "source " + player.source() + " may not create players");
        }
        return create(player, mapping, MatchMethod.CREATED, options.getSystemActor());
    }

    private Optional<ResolutionResult> fromExistingMapping(Observed player, SourceMapping mapping) {
        if (mapping.status() == MappingStatus.MATCHED) {
            String canonicalId = store.resolveSurvivor(EntityKind.PLAYER, mapping.canonicalId());
            store.findPlayer(canonicalId).ifPresent(current -> maybeUpdate(current, player, options.getSystemActor()));
            return Optional.of(ResolutionResult.matched(canonicalId, 1.0, MatchMethod.EXACT_ID));
        }
        if (mapping.status() == MappingStatus.FAILED) {
            return Optional.of(ResolutionResult.unmatched(mapping.confidence()));
        }
        if (mapping.status() == MappingStatus.MANUAL_REVIEW) {
            return reviewService.getReviewQueue()
                    .findByRecord(EntityKind.PLAYER, player.sport(), player.source(), player.recordKey())
                    .map(item -> ResolutionResult.manualReview(item.getId(), item.getBestScore()));
        }
        return Optional.empty();
    }

    private List<ScoredCandidate> scoreCandidates(Observed player) {
        List<CanonicalPlayer> pool = player.team() != null
                ? store.findPlayersByTeam(player.sport(), player.team())
                : store.findPlayersByName(player.sport(), player.name().value());
        List<ScoredCandidate> scored = new ArrayList<>();
        for (CanonicalPlayer candidate : pool) {
            if (!isLinkable(candidate, player)) {
                continue;
            }
            if (suffixConflict(candidate, player)) {
                log.debug("player.candidate_excluded canonicalId={} reason=suffix_conflict", candidate.id());
                continue;
            }
            Boolean positionMatch = player.obs().position() != null && candidate.position() != null
                    ? player.obs().position().equalsIgnoreCase(candidate.position())
                    : null;
            ConfidenceScore score = scorer.score(EntityKind.PLAYER, MatchSignals.builder()
                    .nameSimilarity(nameSimilarity.compute(player.name().value(), candidate.normalizedName()))
                    .teamMatch(player.team() != null ? player.team().equals(candidate.team()) : null)
                    .positionMatch(positionMatch)
                    .build());
            metricsService.recordCandidateScore(EntityKind.PLAYER, score.confidence());
            log.debug("player.candidate canonicalId={} confidence={} tier={}",
                    candidate.id(), score.confidence(), score.tier());
            scored.add(new ScoredCandidate(candidate.id(), label(candidate), score));
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::confidence).reversed());
        return scored;
    }

    private ResolutionResult decide(Observed player, SourceMapping mapping, CanonicalPlayer target,
                                    double confidence, MatchMethod method) {
        ConfidenceTier tier = scorer.profile(EntityKind.PLAYER).tierOf(confidence);
        if (tier == ConfidenceTier.AUTO_ACCEPT) {
            return link(player, mapping, target, confidence, method, options.getSystemActor(), false);
        }
        ScoredCandidate candidate = new ScoredCandidate(target.id(), label(target),
                new ConfidenceScore(confidence, tier, MatchSignals.builder().build()));
        return review(player, mapping, List.of(candidate), method.getDescription() + " below auto-accept");
    }

    private ResolutionResult link(Observed player, SourceMapping previous, CanonicalPlayer target,
                                  double confidence, MatchMethod method, String actorId, boolean manual) {
        Map<String, Object> details = matchDetails(player, method, confidence);
        if (player.obs().hasSourceId()) {
            SourceMapping linked = previous != null
                    ? previous.resolvedTo(target.id(), confidence, method)
                    : SourceMapping.matched(EntityKind.PLAYER, player.sport(), player.source(),
                    player.obs().sourceId(), target.id(), confidence, method);
            try {
                store.saveMapping(linked);
            } catch (ConflictException e) {
                if (manual) {
                    throw e;
                }
                if (e.isSourceId()) {
                    log.warn("player.mapping_conflict source={} sourceId={} constraint={}",
                            player.source(), player.obs().sourceId(), e.getConstraint());
                    return rereadMapping(player, e);
                }
                if (e.isCanonicalSource()) {
                    log.warn("player.source_already_linked canonicalId={} source={}", target.id(), player.source());
                    ScoredCandidate candidate = new ScoredCandidate(target.id(), label(target),
                            new ConfidenceScore(confidence, ConfidenceTier.MANUAL_REVIEW,
                                    MatchSignals.builder().build()));
                    return review(player, previous, List.of(candidate), "player already linked to another id from "
                            + player.source());
                }
                throw e;
            }
            auditLogger.mapping(previous, linked, actorId, details);
        }
        recordAlias(player, target, confidence, manual, actorId);
        maybeUpdate(target, player, actorId);
        return manual ? ResolutionResult.approved(target.id(), false)
                : ResolutionResult.matched(target.id(), confidence, method);
    }

    private ResolutionResult create(Observed player, SourceMapping previous, MatchMethod method, String actorId) {
        CanonicalPlayer created = CanonicalPlayer.builder()
                .sport(player.sport())
                .canonicalName(player.obs().name())
                .normalizedName(player.name().value())
                .suffix(player.name().suffix().token())
                .team(player.team())
                .position(player.obs().position())
                .primarySource(player.source())
                .build();
        SourceMapping mapping = null;
        if (player.obs().hasSourceId()) {
            mapping = previous != null
                    ? previous.resolvedTo(created.id(), 1.0, method)
                    : SourceMapping.matched(EntityKind.PLAYER, player.sport(), player.source(),
                    player.obs().sourceId(), created.id(), 1.0, method);
        }
        boolean manual = method == MatchMethod.MANUAL;
        try {
            store.createPlayer(created, mapping, null);
        } catch (ConflictException e) {
            if (e.isSourceId() && !manual) {
                log.warn("player.mapping_conflict source={} sourceId={} constraint={}",
                        player.source(), player.obs().sourceId(), e.getConstraint());
                return rereadMapping(player, e);
            }
            throw e;
        }

        Map<String, Object> details = matchDetails(player, method, 1.0);
        CanonicalPlayer stored = mapping != null
                ? created.withSourceIds(Map.of(player.source(), player.obs().sourceId()))
                : created;
        auditLogger.created(EntityKind.PLAYER, created.id(), actorId, AuditLogger.snapshot(stored), details);
        if (mapping != null) {
            auditLogger.mapping(previous, mapping, actorId, details);
        }
        metricsService.incrementEntityCreated(EntityKind.PLAYER);
        log.info("player.created canonicalId={} name={} team={} source={}",
                created.id(), created.canonicalName(), created.team(), player.source());
        return manual ? ResolutionResult.approved(created.id(), true) : ResolutionResult.created(created.id());
    }

    private ResolutionResult rereadMapping(Observed player, ConflictException conflict) {
        SourceMapping winner = store.findMapping(EntityKind.PLAYER, player.sport(), player.source(),
                player.obs().sourceId()).orElseThrow(() -> conflict);
        return fromExistingMapping(player, winner).orElseThrow(() -> conflict);
    }

    private ResolutionResult review(Observed player, SourceMapping previous, List<ScoredCandidate> candidates,
                                    String reason) {
        double best = candidates.isEmpty() ? 0.0 : candidates.get(0).confidence();
        if (player.obs().hasSourceId()) {
            if (previous == null) {
                SourceMapping inReview = SourceMapping.inReview(EntityKind.PLAYER, player.sport(), player.source(),
                        player.obs().sourceId(), best);
                try {
                    store.saveMapping(inReview);
                    auditLogger.mapping(null, inReview, options.getSystemActor(), Map.of("reason", reason));
                } catch (ConflictException e) {
                    if (!e.isSourceId()) {
                        throw e;
                    }
                    SourceMapping winner = store.findMapping(EntityKind.PLAYER, player.sport(), player.source(),
                            player.obs().sourceId()).orElseThrow(() -> e);
                    Optional<ResolutionResult> known = fromExistingMapping(player, winner);
                    if (known.isPresent()) {
                        return known.get();
                    }
                }
            } else if (previous.status() != MappingStatus.MANUAL_REVIEW) {
                SourceMapping inReview = store.saveMapping(previous.awaitingReview(best));
                auditLogger.mapping(previous, inReview, options.getSystemActor(), Map.of("reason", reason));
            }
        }

        // Context hints are not part of the raw record; keep them so a reviewer's decision can use them.
        Map<String, Object> fields = new LinkedHashMap<>(player.obs().raw().fields());
        if (player.obs().team() != null) {
            fields.putIfAbsent(SourceRecord.TEAM, player.obs().team());
        }
        if (player.obs().position() != null) {
            fields.putIfAbsent(SourceRecord.POSITION, player.obs().position());
        }

        ReviewItem item = reviewService.submitForReview(ReviewItem.builder()
                .kind(EntityKind.PLAYER)
                .sport(player.sport())
                .source(player.source())
                .recordKey(player.recordKey())
                .sourceRecordId(player.obs().raw().id())
                .recordFields(fields)
                .candidates(candidates.stream().map(ScoredCandidate::toReviewCandidate).toList())
                .bestScore(best)
                .reason(reason)
                .build());
        log.info("player.queued_for_review source={} recordKey={} reviewItemId={} reason={}",
                player.source(), player.recordKey(), item.getId(), reason);
        return ResolutionResult.manualReview(item.getId(), item.getBestScore());
    }

    /**
     * Records the observed spelling as an alias of {@code target} when it differs from the canonical name.
     * A reviewer's approval records it verified, or verifies an alias recorded earlier.
     */
    private void recordAlias(Observed player, CanonicalPlayer target, double confidence, boolean manual,
                             String actorId) {
        NormalizedName canonical = new NormalizedName(target.normalizedName(),
                GenerationalSuffix.fromToken(target.suffix()));
        if (canonical.key().equals(player.name().key())) {
            return;
        }
        Optional<PlayerAlias> existing = store.findAlias(player.sport(), player.name().key(), player.source());
        PlayerAlias alias;
        if (existing.isPresent()) {
            PlayerAlias current = existing.get();
            boolean samePlayer = store.resolveSurvivor(EntityKind.PLAYER, current.canonicalId()).equals(target.id());
            if (!manual || (samePlayer && current.verified())) {
                return;
            }
            alias = current.repointedTo(target.id()).asVerified();
        } else {
            alias = PlayerAlias.of(target.id(), player.sport(), player.obs().name(), player.name().key(),
                    player.source(), manual ? 1.0 : confidence, manual);
        }
        try {
            store.saveAlias(alias);
        } catch (ConflictException e) {
            log.warn("player.alias_conflict canonicalId={} aliasKey={} source={}",
                    target.id(), alias.aliasKey(), alias.aliasSource());
            return;
        }
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("aliasName", alias.aliasName());
        state.put("aliasKey", alias.aliasKey());
        state.put("aliasSource", alias.aliasSource());
        state.put("confidence", alias.confidence());
        state.put("verified", alias.verified());
        auditLogger.record(AuditAction.ALIAS_CREATED, EntityKind.PLAYER, target.id(), actorId,
                null, state, Map.of("sourceRecordId", player.obs().raw().id()));
        log.info("player.alias_recorded canonicalId={} alias={} source={} verified={}",
                target.id(), alias.aliasName(), alias.aliasSource(), alias.verified());
    }

    /**
     * A confident match that reports a new team or position (a trade, a role change) updates the player.
     */
    private void maybeUpdate(CanonicalPlayer current, Observed player, String actorId) {
        boolean teamChanged = player.team() != null && !player.team().equals(current.team());
        boolean positionChanged = player.obs().position() != null
                && !player.obs().position().equalsIgnoreCase(Objects.toString(current.position(), ""));
        if (!teamChanged && !positionChanged) {
            return;
        }
        CanonicalPlayer updated = current.toBuilder()
                .team(teamChanged ? player.team() : current.team())
                .position(positionChanged ? player.obs().position() : current.position())
                .updatedAt(Instant.now())
                .build();
        store.updatePlayer(updated);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", player.source());
        details.put("sourceRecordId", player.obs().raw().id());
        auditLogger.updated(EntityKind.PLAYER, current.id(), actorId, AuditLogger.snapshot(current),
                AuditLogger.snapshot(updated), details);
        log.info("player.updated canonicalId={} team={} position={}",
                current.id(), updated.team(), updated.position());
    }

    // ── Review decisions ──────────────────────────────────────

    @Override
    public ResolutionResult applyApproval(ReviewItem item, String candidateId, String reviewerId) {
        Observed player = observe(PlayerObservation.from(GameMatcher.rebuild(item), PlayerContext.empty()));
        SourceMapping previous = player.obs().hasSourceId()
                ? store.findMapping(EntityKind.PLAYER, player.sport(), player.source(), player.obs().sourceId())
                .orElse(null)
                : null;
        if (candidateId != null) {
            String targetId = store.resolveSurvivor(EntityKind.PLAYER, candidateId);
            CanonicalPlayer target = store.findPlayer(targetId)
                    .orElseThrow(() -> new IllegalArgumentException("Player not found: " + candidateId));
            return link(player, previous, target, 1.0, MatchMethod.MANUAL, reviewerId, true);
        }
        return create(player, previous, MatchMethod.MANUAL, reviewerId);
    }

    @Override
    public void applyRejection(ReviewItem item, String reviewerId) {
        if (item.isKeyedByName()) {
            return;
        }
        Optional<SourceMapping> previous = store.findMapping(EntityKind.PLAYER, item.getSport(), item.getSource(),
                item.getRecordKey());
        SourceMapping unmatched = previous
                .map(SourceMapping::markedUnmatched)
                .orElseGet(() -> SourceMapping.inReview(EntityKind.PLAYER, item.getSport(), item.getSource(),
                        item.getRecordKey(), item.getBestScore()).markedUnmatched());
        store.saveMapping(unmatched);
        auditLogger.mapping(previous.orElse(null), unmatched, reviewerId, Map.of("reviewItemId", item.getId()));
    }

    private Observed observe(PlayerObservation obs) {
        NormalizedName name = normalizer.normalizePlayer(obs.name());
        if (name.isEmpty()) {
            throw new ValidationException(SourceRecord.NAME, "normalizes to an empty name: " + obs.name());
        }
        String team = obs.team() != null
                ? teams.resolve(obs.sport(), obs.source(), obs.team()).orElse(null)
                : null;
        return new Observed(obs, name, team);
    }

    private static boolean suffixConflict(CanonicalPlayer candidate, Observed player) {
        return GenerationalSuffix.fromToken(candidate.suffix()).conflictsWith(player.name().suffix());
    }

    private boolean isLinkable(CanonicalPlayer candidate, Observed player) {
        String linkedId = candidate.sourceIds().get(player.source());
        return linkedId == null || linkedId.equals(player.obs().sourceId());
    }

    private static String label(CanonicalPlayer player) {
        return player.canonicalName() + (player.team() != null ? " (" + player.team() + ")" : "");
    }

    private Map<String, Object> matchDetails(Observed player, MatchMethod method, double confidence) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", method.name());
        details.put("description", method.getDescription());
        details.put("confidence", confidence);
        details.put("source", player.source());
        details.put("recordKey", player.recordKey());
        details.put("sourceRecordId", player.obs().raw().id());
        return details;
    }

    /**
     * A validated record with its normalized name and resolved team code.
     */
    private record Observed(PlayerObservation obs, NormalizedName name, String team) {

        String sport() {
            return obs.sport();
        }

        String source() {
            return obs.source();
        }

        String recordKey() {
            return obs.hasSourceId() ? obs.sourceId() : ReviewItem.NAME_KEY_PREFIX + name.key();
        }
    }
}
