package org.lumina.atlas.api;

/**
 * Thrown (or used to complete a decode future exceptionally) when a single photo cannot
 * be decoded.
 * <p>
 * A retryable failure (e.g., a transient I/O error) is attempted once more by the pipeline.
 * A non-retryable one (unsupported or corrupt file) is remembered and reported without
 * reloading until the record expires.
 */
public class PhotoDecodeException extends RuntimeException {

    private final String photoId;
    private final boolean retryable;

    /**
     * @param photoId   Identifier of the photo that failed.
     * @param reason    Human-readable reason.
     * @param retryable Whether a second attempt may succeed.
     */
    public PhotoDecodeException(String photoId, String reason, boolean retryable) {
        super(String.format("Failed to decode photo '%s': %s", photoId, reason));
        this.photoId = photoId;
        this.retryable = retryable;
    }

    public PhotoDecodeException(String photoId, String reason, boolean retryable, Throwable cause) {
        super(String.format("Failed to decode photo '%s': %s", photoId, reason), cause);
        this.photoId = photoId;
        this.retryable = retryable;
    }

    public String getPhotoId() {
        return photoId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
