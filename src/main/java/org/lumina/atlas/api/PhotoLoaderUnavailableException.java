package org.lumina.atlas.api;

/**
 * Thrown when the photo loader as a whole cannot serve requests (e.g., storage was
 * unmounted or permission was revoked).
 * <p>
 * Fails the whole generation task; previously cached atlases stay in place.
 */
public class PhotoLoaderUnavailableException extends RuntimeException {

    public PhotoLoaderUnavailableException(String message) {
        super(message);
    }

    public PhotoLoaderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
