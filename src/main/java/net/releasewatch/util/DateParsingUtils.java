package net.releasewatch.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for the date formats found in RSS and Atom feeds.
 * Centralizes date parsing logic so adapters stay format-agnostic.
 */
public final class DateParsingUtils {

    // RSS 2.0 uses RFC 822/1123, Atom uses RFC 3339; some feeds drop the seconds or the weekday
    private static final List<DateTimeFormatter> ZONED_FORMATS = List.of(
        DateTimeFormatter.RFC_1123_DATE_TIME,
        DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm Z", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMM yyyy HH:mm:ss Z", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss zzz", Locale.ENGLISH)
    );

    private DateParsingUtils() {
        // Utility class
    }

    /**
     * Parses a feed timestamp, trying RFC 1123 variants, ISO offset date-times and plain ISO dates.
     *
     * @param value the raw timestamp text
     * @param zone  zone used for date-only values
     * @return the parsed instant or {@code null} if no format matched
     */
    public static Instant parseFeedTimestamp(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.strip();

        for (DateTimeFormatter format : ZONED_FORMATS) {
            try {
                return ZonedDateTime.parse(trimmed, format).toInstant();
            } catch (DateTimeParseException e) {
                // Continue to next format
            }
        }

        try {
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            // Continue
        }

        LocalDate date = parseIsoLocalDate(trimmed.length() >= 10 ? trimmed.substring(0, 10) : trimmed);
        return date != null ? date.atStartOfDay(zone).toInstant() : null;
    }

    /**
     * Parses an ISO date string (yyyy-MM-dd).
     *
     * @param dateString the ISO date string
     * @return parsed LocalDate or null if parsing fails
     */
    public static LocalDate parseIsoLocalDate(String dateString) {
        if (dateString == null || dateString.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(dateString.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Date of an instant in the given zone, or {@code null} when the instant is absent.
     */
    public static LocalDate toLocalDate(Instant instant, ZoneId zone) {
        return instant == null ? null : instant.atZone(zone).toLocalDate();
    }
}
