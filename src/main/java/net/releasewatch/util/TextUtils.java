package net.releasewatch.util;

import org.jsoup.Jsoup;

/**
 * Small text helpers shared by the feed parser, the normalizer and the filter.
 */
public final class TextUtils {

    private TextUtils() {
    }

    /**
     * Collapses runs of whitespace (full-width spaces included) into single spaces and trims.
     * Returns an empty string for {@code null}.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('　', ' ').replaceAll("\\s+", " ").strip();
    }

    /**
     * Strips HTML markup and collapses whitespace.
     */
    public static String stripMarkup(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return collapseWhitespace(Jsoup.parse(value).text());
    }

    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (hasText(candidate)) {
                return candidate.strip();
            }
        }
        return null;
    }
}
