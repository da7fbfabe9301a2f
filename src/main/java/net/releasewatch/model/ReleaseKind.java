package net.releasewatch.model;

/**
 * Kind of content unit a release represents.
 */
public enum ReleaseKind {
    EPISODE,
    VOLUME,
    SPECIAL;

    /** Default release kind used when a source title carries no recognizable marker. */
    public static ReleaseKind defaultFor(WorkKind workKind) {
        return workKind == WorkKind.ANIME ? EPISODE : VOLUME;
    }
}
