package org.lumina.atlas.model;

/**
 * An image sized for packing at one detail level.
 * <p>
 * {@code width}/{@code height} are the dimensions the packer sees; the natural dimensions
 * are kept so the image can be re-sized for another level (e.g., the focused photo is
 * planned at the maximum level).
 *
 * @param id            Image identifier.
 * @param width         Target width in pixels.
 * @param height        Target height in pixels.
 * @param naturalWidth  Natural width in pixels.
 * @param naturalHeight Natural height in pixels.
 */
public record PlanImage(String id, int width, int height, int naturalWidth, int naturalHeight) {

    public PlanImage {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(String.format(
                "Plan image '%s' must have positive dimensions, got %dx%d", id, width, height));
        }
    }

    /**
     * Fits the natural size into the level's square resolution box, preserving aspect ratio.
     * The longer side becomes the level resolution, the shorter side is at least 1 pixel.
     */
    public static PlanImage at(SourceImage source, DetailLevel level) {
        int target = level.resolution();
        int w;
        int h;
        if (source.width() >= source.height()) {
            w = target;
            h = Math.max(1, (int) Math.round((double) target * source.height() / source.width()));
        } else {
            h = target;
            w = Math.max(1, (int) Math.round((double) target * source.width() / source.height()));
        }
        return new PlanImage(source.id(), w, h, source.width(), source.height());
    }

    /**
     * Uses the given dimensions unchanged, both as target and natural size.
     */
    public static PlanImage exact(String id, int width, int height) {
        return new PlanImage(id, width, height, width, height);
    }

    /**
     * Re-sizes this image for another level from its natural dimensions.
     */
    public PlanImage resizedFor(DetailLevel level) {
        return at(new SourceImage(id, naturalWidth, naturalHeight), level);
    }

    public long area() {
        return (long) width * height;
    }
}
