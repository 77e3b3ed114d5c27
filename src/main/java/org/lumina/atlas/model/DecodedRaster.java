package org.lumina.atlas.model;

import java.awt.image.BufferedImage;

/**
 * A decoded photo ready to be drawn into an atlas.
 * <p>
 * Ownership is exclusive: the decoder owns it until it is handed to the assembler, which
 * calls {@link #release()} right after drawing. A released raster reports
 * {@link #isUsable()} {@code false} and must not be drawn again.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. One owner at a time.
 */
public final class DecodedRaster {

    private final String id;
    private BufferedImage image;

    public DecodedRaster(String id, BufferedImage image) {
        if (id == null) {
            throw new IllegalArgumentException("Raster id must not be null");
        }
        this.id = id;
        this.image = image;
    }

    public String id() {
        return id;
    }

    /**
     * @return the pixel buffer, or {@code null} once released (or if the decoder produced none).
     */
    public BufferedImage image() {
        return image;
    }

    public int width() {
        return image != null ? image.getWidth() : 0;
    }

    public int height() {
        return image != null ? image.getHeight() : 0;
    }

    /**
     * @return true if the raster still holds a non-empty buffer.
     */
    public boolean isUsable() {
        return image != null && image.getWidth() > 0 && image.getHeight() > 0;
    }

    /**
     * Drops the pixel buffer. Idempotent.
     */
    public void release() {
        if (image != null) {
            image.flush();
            image = null;
        }
    }
}
