package net.releasewatch.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.NormalizedRelease;
import net.releasewatch.util.TextUtils;
import org.springframework.stereotype.Service;

/**
 * Applies the configured content policy to normalized releases.
 *
 * <p>Denylist terms match as case-insensitive substrings of the titles, the first
 * {@value #DESCRIPTION_SCAN_LENGTH} characters of the description and each tag. Denied genres and
 * excluded tags only match whole tag values.</p>
 */
@Slf4j
@Service
public class ContentPolicyFilter {

    static final int DESCRIPTION_SCAN_LENGTH = 500;

    private final List<String> denylist;
    private final Set<String> deniedTags;
    private final boolean excludeAdult;

    public ContentPolicyFilter(ReleaseWatchProperties properties) {
        this.denylist = properties.getDenylist().stream()
            .filter(TextUtils::hasText)
            .map(term -> term.strip().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
        this.deniedTags = Stream.concat(
                properties.getDeniedGenres().stream(), properties.getExcludedTags().stream())
            .filter(TextUtils::hasText)
            .map(tag -> tag.strip().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.excludeAdult = properties.isExcludeAdult();
    }

    public FilterDecision evaluate(NormalizedRelease release) {
        if (excludeAdult && release.adult()) {
            return rejected(release, FilterDecision.reject("adult", "adult"));
        }

        for (String tag : release.tags()) {
            if (tag != null && deniedTags.contains(tag.strip().toLowerCase(Locale.ROOT))) {
                return rejected(release, FilterDecision.reject(tag, "tags"));
            }
        }

        if (denylist.isEmpty()) {
            return FilterDecision.keep();
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("title", release.title());
        fields.put("rawTitle", release.rawTitle());
        fields.put("titleEn", release.titleEn());
        fields.put("titleAlt", release.titleAlt());
        fields.put("description", TextUtils.truncate(release.description(), DESCRIPTION_SCAN_LENGTH));
        for (Map.Entry<String, String> field : fields.entrySet()) {
            String match = firstDeniedTerm(field.getValue());
            if (match != null) {
                return rejected(release, FilterDecision.reject(match, field.getKey()));
            }
        }
        for (String tag : release.tags()) {
            String match = firstDeniedTerm(tag);
            if (match != null) {
                return rejected(release, FilterDecision.reject(match, "tags"));
            }
        }
        return FilterDecision.keep();
    }

    public boolean isAllowed(NormalizedRelease release) {
        return evaluate(release).kept();
    }

    private String firstDeniedTerm(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        String haystack = value.toLowerCase(Locale.ROOT);
        for (String term : denylist) {
            if (haystack.contains(term)) {
                return term;
            }
        }
        return null;
    }

    private static FilterDecision rejected(NormalizedRelease release, FilterDecision decision) {
        log.debug("Filtered '{}' from {}: matched '{}' in {}", release.title(), release.sourceId(),
            decision.matchedTerm(), decision.field());
        return decision;
    }
}
