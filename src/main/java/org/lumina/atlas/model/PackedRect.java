package org.lumina.atlas.model;

/**
 * Placement of one image inside an atlas, excluding its padding margin.
 *
 * @param id     Image identifier.
 * @param x      Left edge in atlas pixels.
 * @param y      Top edge in atlas pixels.
 * @param width  Width in pixels.
 * @param height Height in pixels.
 */
public record PackedRect(String id, int x, int y, int width, int height) {

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    /**
     * Tests whether the two rectangles, each grown by {@code padding} on every side,
     * intersect.
     */
    public boolean paddedIntersects(PackedRect other, int padding) {
        return x - padding < other.right() + padding
            && other.x - padding < right() + padding
            && y - padding < other.bottom() + padding
            && other.y - padding < bottom() + padding;
    }
}
