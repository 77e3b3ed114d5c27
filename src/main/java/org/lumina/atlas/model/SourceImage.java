package org.lumina.atlas.model;

/**
 * A photo known to the pipeline: an opaque identifier plus its natural pixel size.
 *
 * @param id     Stable identifier (e.g., a content URI).
 * @param width  Natural width in pixels.
 * @param height Natural height in pixels.
 */
public record SourceImage(String id, int width, int height) {

    public SourceImage {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Image id must not be blank");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(String.format(
                "Image '%s' must have positive dimensions, got %dx%d", id, width, height));
        }
    }

    public double aspectRatio() {
        return (double) width / height;
    }
}
