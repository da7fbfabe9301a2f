package net.releasewatch.dto;

/**
 * Source-specific intermediate record handed from a source client or feed adapter to the normalizer.
 */
public sealed interface SourceRecord permits AniListAiringRecord, FeedItemRecord {

    /** Identifier of the source that produced the record. */
    String sourceId();

    /** Key used in logs to point at the offending item. */
    String itemKey();
}
