package com.sportsync.resolution.core.model;

import com.sportsync.resolution.core.ValidationException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import static com.sportsync.resolution.core.model.RecordLimits.*;

/**
 * Validated, typed view of a game {@link SourceRecord}.
 */
public record GameObservation(
        SourceRecord raw,
        String sport,
        String source,
        String sourceId,
        String homeTeam,
        String awayTeam,
        String homeTeamId,
        String awayTeamId,
        Instant scheduledAt
) {

    /**
     * Validates the raw record and extracts the fields game matching relies on.
     *
     * @throws ValidationException if a required field is missing, unparseable or too long,
     *                             or both teams are the same
     */
    public static GameObservation from(SourceRecord record) {
        if (record.kind() != EntityKind.GAME) {
            throw new ValidationException("kind", "expected game record but was " + record.kind().wireName());
        }
        String sport = bounded(required(record.sport(), "sport").toLowerCase(Locale.ROOT), "sport",
                MAX_SPORT_LENGTH);
        String source = bounded(required(record.source(), "source"), "source", MAX_SOURCE_LENGTH);
        String sourceId = bounded(required(record.sourceId(), "source_id"), "source_id", MAX_SOURCE_ID_LENGTH);
        String home = bounded(required(record.text(SourceRecord.HOME_TEAM), SourceRecord.HOME_TEAM),
                SourceRecord.HOME_TEAM, MAX_TEAM_NAME_LENGTH);
        String away = bounded(required(record.text(SourceRecord.AWAY_TEAM), SourceRecord.AWAY_TEAM),
                SourceRecord.AWAY_TEAM, MAX_TEAM_NAME_LENGTH);
        if (home.equalsIgnoreCase(away)) {
            throw new ValidationException(SourceRecord.AWAY_TEAM, "same team as home: " + home);
        }
        Instant scheduledAt = parseInstant(record.fields().get(SourceRecord.SCHEDULED_AT));
        return new GameObservation(record, sport, source, sourceId, home, away,
                bounded(record.text(SourceRecord.HOME_TEAM_ID), SourceRecord.HOME_TEAM_ID, MAX_TEAM_ID_LENGTH),
                bounded(record.text(SourceRecord.AWAY_TEAM_ID), SourceRecord.AWAY_TEAM_ID, MAX_TEAM_ID_LENGTH),
                scheduledAt);
    }

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
        return value.trim();
    }

    private static Instant parseInstant(Object value) {
        if (value == null) {
            throw new ValidationException(SourceRecord.SCHEDULED_AT, "is required");
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        String text = value.toString().trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException nested) {
                throw new ValidationException(SourceRecord.SCHEDULED_AT, "not an ISO-8601 timestamp: " + text);
            }
        }
    }
}
