package org.lumina.atlas.api;

import org.lumina.atlas.model.DecodedRaster;

import java.util.concurrent.CompletableFuture;

/**
 * Opaque asynchronous photo decoder.
 * <p>
 * Implementations decode a photo to approximately the requested size (aspect ratio may
 * make one side smaller). The returned future completes exceptionally with:
 * <ul>
 *   <li>{@link PhotoDecodeException} for a failure of this one photo</li>
 *   <li>{@link PhotoLoaderUnavailableException} when the loader cannot serve any request</li>
 * </ul>
 * Cancelling the returned future must be safe; implementations should stop work and
 * release any buffer they hold.
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. The pipeline calls
 * {@link #decode} from several worker threads concurrently.
 */
public interface IPhotoLoader {

    /**
     * Starts decoding a photo.
     *
     * @param id           Image identifier.
     * @param targetWidth  Desired width in pixels.
     * @param targetHeight Desired height in pixels.
     * @return Future completing with a raster owned by the caller.
     */
    CompletableFuture<DecodedRaster> decode(String id, int targetWidth, int targetHeight);
}
