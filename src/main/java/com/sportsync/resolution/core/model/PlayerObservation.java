package com.sportsync.resolution.core.model;

import com.sportsync.resolution.core.ValidationException;

import java.util.Locale;

import static com.sportsync.resolution.core.model.RecordLimits.*;

/**
 * Validated, typed view of a player {@link SourceRecord}.
 * The source id is optional: some providers (prop markets) identify players only by name.
 * Team and position fall back to the {@link PlayerContext} hints.
 */
public record PlayerObservation(
        SourceRecord raw,
        String sport,
        String source,
        String sourceId,
        String name,
        String team,
        String position
) {

    public static PlayerObservation from(SourceRecord record, PlayerContext context) {
        if (record.kind() != EntityKind.PLAYER) {
            throw new ValidationException("kind", "expected player record but was " + record.kind().wireName());
        }
        PlayerContext ctx = context != null ? context : PlayerContext.empty();
        String sport = bounded(GameObservation.required(record.sport(), "sport").toLowerCase(Locale.ROOT), "sport",
                MAX_SPORT_LENGTH);
        String source = bounded(GameObservation.required(record.source(), "source"), "source", MAX_SOURCE_LENGTH);
        String name = bounded(GameObservation.required(record.text(SourceRecord.NAME), SourceRecord.NAME),
                SourceRecord.NAME, MAX_PLAYER_NAME_LENGTH);
        String sourceId = record.sourceId() != null && !record.sourceId().isBlank()
                ? bounded(record.sourceId().trim(), "source_id", MAX_SOURCE_ID_LENGTH)
                : null;
        String team = bounded(record.text(SourceRecord.TEAM) != null ? record.text(SourceRecord.TEAM) : ctx.teamCode(),
                SourceRecord.TEAM, MAX_TEAM_NAME_LENGTH);
        String position = bounded(record.text(SourceRecord.POSITION) != null
                ? record.text(SourceRecord.POSITION) : ctx.position(), SourceRecord.POSITION, MAX_POSITION_LENGTH);
        return new PlayerObservation(record, sport, source, sourceId, name, team, position);
    }

    public boolean hasSourceId() {
        return sourceId != null;
    }
}
