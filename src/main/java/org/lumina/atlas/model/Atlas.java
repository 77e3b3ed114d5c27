package org.lumina.atlas.model;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fixed-size square texture holding many packed photos.
 * <p>
 * An atlas is fully assembled before it is published and is never redrawn afterwards;
 * consumers must treat {@link #image()} as read-only. The only mutable bit is the
 * invalidation flag, set when the buffer was reclaimed outside the pipeline.
 * <p>
 * <strong>Thread Safety:</strong> Safe for concurrent readers.
 */
public final class Atlas {

    private static final int BYTES_PER_PIXEL = 4;

    private final BufferedImage image;
    private final int size;
    private final Map<String, AtlasRegion> regions;
    private final DetailLevel detailLevel;
    private final AtlasClass atlasClass;
    private final long generation;
    private final AtomicBoolean invalidated = new AtomicBoolean(false);

    /**
     * @param image       Composed ARGB buffer, {@code size × size}.
     * @param regions     Region index keyed by image id.
     * @param detailLevel Level every region was rendered at.
     * @param atlasClass  Cache class the atlas is produced for.
     * @param generation  Sequence number of the request that produced the atlas.
     */
    public Atlas(BufferedImage image, Map<String, AtlasRegion> regions, DetailLevel detailLevel,
                 AtlasClass atlasClass, long generation) {
        if (image == null) {
            throw new IllegalArgumentException("Atlas image must not be null");
        }
        if (image.getWidth() != image.getHeight()) {
            throw new IllegalArgumentException(String.format(
                "Atlas must be square, got %dx%d", image.getWidth(), image.getHeight()));
        }
        this.image = image;
        this.size = image.getWidth();
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
        this.detailLevel = detailLevel;
        this.atlasClass = atlasClass;
        this.generation = generation;
    }

    public BufferedImage image() {
        return image;
    }

    public int size() {
        return size;
    }

    public Map<String, AtlasRegion> regions() {
        return regions;
    }

    public Optional<AtlasRegion> region(String id) {
        return Optional.ofNullable(regions.get(id));
    }

    public boolean contains(String id) {
        return regions.containsKey(id);
    }

    public DetailLevel detailLevel() {
        return detailLevel;
    }

    public AtlasClass atlasClass() {
        return atlasClass;
    }

    public long generation() {
        return generation;
    }

    public long memoryBytes() {
        return (long) size * size * BYTES_PER_PIXEL;
    }

    /**
     * Fraction of the atlas area covered by regions.
     */
    public double utilization() {
        long used = 0;
        for (AtlasRegion region : regions.values()) {
            used += region.area();
        }
        return (double) used / ((double) size * size);
    }

    /**
     * Marks this atlas as reclaimed. Lookups skip invalidated atlases and the next
     * regeneration decision becomes a full one.
     *
     * @return true if this call changed the state.
     */
    public boolean invalidate() {
        return invalidated.compareAndSet(false, true);
    }

    public boolean isInvalidated() {
        return invalidated.get();
    }

    @Override
    public String toString() {
        return String.format("Atlas[%s %s %dpx, %d regions, gen=%d%s]",
            atlasClass, detailLevel, size, regions.size(), generation,
            isInvalidated() ? ", invalidated" : "");
    }
}
