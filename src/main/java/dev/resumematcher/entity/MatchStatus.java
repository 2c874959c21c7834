package dev.resumematcher.entity;

import java.util.Locale;

/**
 * Review state of a match. Any state may move to any other by user action;
 * a rejected match cannot be scheduled for interview.
 */
public enum MatchStatus {
    PENDING,
    SHORTLISTED,
    REJECTED,
    MAYBE;

    /**
     * Parse a status name case-insensitively.
     *
     * @throws IllegalArgumentException for null or unknown values
     */
    public static MatchStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Match status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown match status: " + value, e);
        }
    }
}
