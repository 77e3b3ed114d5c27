package org.lumina.atlas.model;

/**
 * Discrete level of detail for atlas generation.
 * <p>
 * Each level binds a target raster resolution (the longer side of a photo once scaled)
 * to a half-open zoom range {@code [zoomLow, zoomHigh)}. The ranges are contiguous and
 * ordered, so every zoom value maps to exactly one level. Values below the first lower
 * bound clamp to {@link #LEVEL_0}, values at or above the last upper bound clamp to
 * {@link #LEVEL_7}.
 * <p>
 * <strong>Memory per photo</strong> (ARGB, square worst case): 4 KB at LEVEL_0 up to
 * ~2.3 MB at LEVEL_7.
 */
public enum DetailLevel {

    /** Ultra-tiny previews, the whole collection visible. */
    LEVEL_0(32, 0.0, 0.3),

    /** Tiny thumbnails, general composition recognisable. */
    LEVEL_1(64, 0.3, 0.8),

    /** Small thumbnails, standard browsing. */
    LEVEL_2(128, 0.8, 1.5),

    /** Medium thumbnails. */
    LEVEL_3(192, 1.5, 2.5),

    /** Large thumbnails, faces recognisable. */
    LEVEL_4(256, 2.5, 4.0),

    /** High-quality thumbnails for detailed inspection. */
    LEVEL_5(384, 4.0, 6.5),

    /** Focused view, photos cover a significant screen area. */
    LEVEL_6(512, 6.5, 10.0),

    /** Near-fullscreen preview. */
    LEVEL_7(768, 10.0, 16.0);

    private static final int BYTES_PER_PIXEL = 4;
    private static final double PACKING_EFFICIENCY = 0.8;

    private final int resolution;
    private final double zoomLow;
    private final double zoomHigh;

    DetailLevel(int resolution, double zoomLow, double zoomHigh) {
        this.resolution = resolution;
        this.zoomLow = zoomLow;
        this.zoomHigh = zoomHigh;
    }

    public int resolution() {
        return resolution;
    }

    public double zoomLow() {
        return zoomLow;
    }

    public double zoomHigh() {
        return zoomHigh;
    }

    /**
     * @return true if {@code zoom} lies in this level's half-open range.
     */
    public boolean contains(double zoom) {
        return zoom >= zoomLow && zoom < zoomHigh;
    }

    /**
     * Returns the next higher level, or this level if it is already the highest.
     */
    public DetailLevel next() {
        DetailLevel[] levels = values();
        return ordinal() + 1 < levels.length ? levels[ordinal() + 1] : this;
    }

    public boolean isAtLeast(DetailLevel other) {
        return ordinal() >= other.ordinal();
    }

    public static DetailLevel min() {
        return LEVEL_0;
    }

    public static DetailLevel max() {
        DetailLevel[] levels = values();
        return levels[levels.length - 1];
    }

    /**
     * Estimated bytes of one square photo at this resolution.
     */
    public long memoryBytesPerPhoto() {
        return (long) resolution * resolution * BYTES_PER_PIXEL;
    }

    /**
     * Rough number of square photos of this level that fit in one atlas of the given size,
     * assuming ~80% packing efficiency.
     *
     * @param atlasSize Atlas edge length in pixels.
     * @return Estimated capacity, at least 1.
     */
    public int capacityIn(int atlasSize) {
        double atlasArea = (double) atlasSize * atlasSize;
        double photoArea = (double) resolution * resolution;
        return Math.max(1, (int) (atlasArea * PACKING_EFFICIENCY / photoArea));
    }
}
