package net.releasewatch.model;

import java.util.Locale;

/**
 * Closed set of work categories tracked by the collector.
 */
public enum WorkKind {
    ANIME,
    MANGA;

    /**
     * Parses a configuration value such as {@code "anime"} or {@code "MANGA"}.
     *
     * @throws IllegalArgumentException when the value names no known kind
     */
    public static WorkKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Work kind must not be blank");
        }
        return WorkKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
