package net.releasewatch.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.releasewatch.model.ReleaseKind;
import net.releasewatch.model.WorkKind;

/**
 * Extracts the release marker (episode, volume or special) from a free-form feed title.
 *
 * <p>Numbers that are plain decimals are normalized (full-width digits folded, leading zeros
 * dropped). Anything else captured inside a marker, such as kanji numerals, is kept verbatim
 * as an opaque label.</p>
 */
public final class ReleaseTitleParser {

    static final int MAX_LABEL_LENGTH = 32;

    private static final String LABEL = "([0-9０-９一二三四五六七八九十百千〇零]+)";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> EPISODE_PATTERNS = List.of(
        Pattern.compile("第\\s*" + LABEL + "\\s*話", FLAGS),
        Pattern.compile("#\\s*([0-9０-９]+)", FLAGS),
        Pattern.compile("\\bep\\.\\s*([0-9０-９]+)", FLAGS),
        Pattern.compile("\\bepisode\\s*([0-9０-９]+)", FLAGS)
    );

    private static final List<Pattern> VOLUME_PATTERNS = List.of(
        Pattern.compile("第\\s*" + LABEL + "\\s*巻", FLAGS),
        Pattern.compile("([0-9０-９]+)\\s*巻", FLAGS),
        Pattern.compile("\\bvol\\.?\\s*([0-9０-９]+)", FLAGS),
        Pattern.compile("\\bvolume\\s*([0-9０-９]+)", FLAGS)
    );

    private static final List<Pattern> SPECIAL_PATTERNS = List.of(
        Pattern.compile("特別編", FLAGS),
        Pattern.compile("番外編", FLAGS),
        Pattern.compile("\\bSP\\b"),
        Pattern.compile("\\bspecial\\b", FLAGS),
        Pattern.compile("\\bOVA\\b", FLAGS)
    );

    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s\\-–:：/|、,]+$");
    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s\\-–:：/|、,]+");

    /**
     * Outcome of parsing one title.
     *
     * @param workTitle   title with the release marker removed
     * @param releaseKind detected kind, or the default for the work kind
     * @param number      normalized label, empty when none was found
     */
    public record ParsedTitle(String workTitle, ReleaseKind releaseKind, String number) {
    }

    private ReleaseTitleParser() {
    }

    public static ParsedTitle parse(String rawTitle, WorkKind workKind) {
        String title = TextUtils.collapseWhitespace(rawTitle);
        if (title.isEmpty()) {
            return new ParsedTitle("", ReleaseKind.defaultFor(workKind), "");
        }

        ParsedTitle match = firstMatch(title, EPISODE_PATTERNS, ReleaseKind.EPISODE, true);
        if (match == null) {
            match = firstMatch(title, VOLUME_PATTERNS, ReleaseKind.VOLUME, true);
        }
        if (match == null) {
            match = firstMatch(title, SPECIAL_PATTERNS, ReleaseKind.SPECIAL, false);
        }
        if (match == null) {
            return new ParsedTitle(title, ReleaseKind.defaultFor(workKind), "");
        }
        return match;
    }

    /**
     * Normalizes a release label: decimal labels lose leading zeros, other labels are kept as-is.
     * Labels are capped at {@value #MAX_LABEL_LENGTH} characters.
     */
    public static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        String trimmed = label.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        String normalized = trimmed;
        if (isDecimal(trimmed)) {
            StringBuilder digits = new StringBuilder(trimmed.length());
            for (int i = 0; i < trimmed.length(); i++) {
                digits.append(Character.forDigit(Character.digit(trimmed.charAt(i), 10), 10));
            }
            normalized = digits.toString().replaceFirst("^0+(?=\\d)", "");
        }
        return normalized.length() > MAX_LABEL_LENGTH ? normalized.substring(0, MAX_LABEL_LENGTH) : normalized;
    }

    private static ParsedTitle firstMatch(String title, List<Pattern> patterns, ReleaseKind kind, boolean numbered) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(title);
            if (matcher.find()) {
                String number = numbered ? normalizeLabel(matcher.group(1)) : "";
                String remaining = title.substring(0, matcher.start()) + " " + title.substring(matcher.end());
                return new ParsedTitle(cleanWorkTitle(remaining, title), kind, number);
            }
        }
        return null;
    }

    private static String cleanWorkTitle(String remaining, String fallback) {
        String cleaned = TextUtils.collapseWhitespace(remaining);
        cleaned = TRAILING_SEPARATORS.matcher(cleaned).replaceAll("");
        cleaned = LEADING_SEPARATORS.matcher(cleaned).replaceAll("");
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    private static boolean isDecimal(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 10) < 0) {
                return false;
            }
        }
        return true;
    }
}
