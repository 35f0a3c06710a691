package com.sportsync.resolution.core.model;

import com.sportsync.resolution.core.ValidationException;

/**
 * Size limits for source record fields, matching the widths of the columns they end up in.
 * Checked when a record is turned into an observation so an oversized value fails that record
 * alone instead of the store write that would hold it.
 */
public final class RecordLimits {

    public static final int MAX_SPORT_LENGTH = 32;
    public static final int MAX_SOURCE_LENGTH = 64;
    public static final int MAX_SOURCE_ID_LENGTH = 128;
    public static final int MAX_TEAM_NAME_LENGTH = 100;
    public static final int MAX_TEAM_ID_LENGTH = 64;
    /** Leaves room for the {@code name:} prefix of id-less player review keys. */
    public static final int MAX_PLAYER_NAME_LENGTH = 150;
    public static final int MAX_POSITION_LENGTH = 16;
    /** Width of {@code review_items.reason}. */
    public static final int MAX_REVIEW_REASON_LENGTH = 200;

    private RecordLimits() {
        // utility class
    }

    /**
     * Returns the value unchanged when it fits.
     *
     * @throws ValidationException if the value is longer than {@code max} or contains control characters
     */
    public static String bounded(String value, String field, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() > max) {
            throw new ValidationException(field, "exceeds " + max + " characters (was " + value.length() + ")");
        }
        if (containsControlCharacters(value)) {
            throw new ValidationException(field, "must not contain control characters");
        }
        return value;
    }

    /**
     * Cuts free text to {@code max} characters, marking the cut with "...".
     */
    public static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 3) + "...";
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
