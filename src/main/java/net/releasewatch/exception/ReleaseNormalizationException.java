package net.releasewatch.exception;

/**
 * A source record could not be mapped to the canonical release shape.
 */
public class ReleaseNormalizationException extends RuntimeException {

    private final String itemKey;

    public ReleaseNormalizationException(String itemKey, String message) {
        super(message + " (item=" + itemKey + ")");
        this.itemKey = itemKey;
    }

    public String getItemKey() {
        return itemKey;
    }
}
