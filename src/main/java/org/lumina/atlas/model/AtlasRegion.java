package org.lumina.atlas.model;

/**
 * Locates one photo inside an {@link Atlas}. Used by renderers as the source rectangle
 * when drawing from the atlas buffer.
 *
 * @param id          Image identifier.
 * @param x           Left edge in atlas pixels.
 * @param y           Top edge in atlas pixels.
 * @param width       Width in atlas pixels.
 * @param height      Height in atlas pixels.
 * @param aspectRatio Width / height of the photo, preserved across levels.
 * @param detailLevel Level the region was rendered at.
 */
public record AtlasRegion(String id, int x, int y, int width, int height,
                          double aspectRatio, DetailLevel detailLevel) {

    public static AtlasRegion of(PackedRect rect, double aspectRatio, DetailLevel detailLevel) {
        return new AtlasRegion(rect.id(), rect.x(), rect.y(), rect.width(), rect.height(),
            aspectRatio, detailLevel);
    }

    public long area() {
        return (long) width * height;
    }
}
