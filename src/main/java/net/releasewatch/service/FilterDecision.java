package net.releasewatch.service;

/**
 * Outcome of the content policy check for one release.
 *
 * @param kept        whether the release passes the policy
 * @param matchedTerm denylist term, genre or tag that caused the rejection
 * @param field       field the term was found in
 */
public record FilterDecision(boolean kept, String matchedTerm, String field) {

    private static final FilterDecision KEEP = new FilterDecision(true, null, null);

    public static FilterDecision keep() {
        return KEEP;
    }

    public static FilterDecision reject(String matchedTerm, String field) {
        return new FilterDecision(false, matchedTerm, field);
    }
}
