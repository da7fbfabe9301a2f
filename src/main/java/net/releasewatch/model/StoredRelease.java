package net.releasewatch.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted release joined with its owning work, as read back from the store.
 */
public record StoredRelease(
    long id,
    long workId,
    String workTitle,
    WorkKind workKind,
    ReleaseKind releaseKind,
    String number,
    String platform,
    LocalDate releaseDate,
    String source,
    String sourceUrl,
    boolean notified,
    String eventRef,
    Instant createdAt
) {

    public boolean hasNumber() {
        return number != null && !number.isBlank();
    }

    public boolean hasPlatform() {
        return platform != null && !platform.isBlank();
    }

    public boolean hasEventRef() {
        return eventRef != null && !eventRef.isBlank();
    }
}
