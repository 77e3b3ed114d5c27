package org.lumina.atlas.lod;

import java.util.Optional;

import org.lumina.atlas.model.DetailLevel;

/**
 * Maps zoom factors to {@link DetailLevel}s.
 * <p>
 * Levels are looked up by binary search over their lower zoom bounds. Zooms below the
 * first bound clamp to the lowest level, zooms at or above the last upper bound clamp to
 * the highest level.
 * <p>
 * This class is stateless and thread-safe.
 */
public class LodPolicy {

    private static final DetailLevel[] LEVELS = DetailLevel.values();
    private static final double[] LOWER_BOUNDS = new double[LEVELS.length];

    static {
        for (int i = 0; i < LEVELS.length; i++) {
            LOWER_BOUNDS[i] = LEVELS[i].zoomLow();
        }
    }

    /**
     * @param zoom Current zoom factor.
     * @return The level whose half-open range contains {@code zoom}, clamped at both ends.
     * @throws IllegalArgumentException if {@code zoom} is NaN.
     */
    public DetailLevel levelFor(final double zoom) {
        if (Double.isNaN(zoom)) {
            throw new IllegalArgumentException("Zoom must not be NaN");
        }
        // Largest index with LOWER_BOUNDS[i] <= zoom
        int low = 0;
        int high = LOWER_BOUNDS.length - 1;
        int found = 0;
        while (low <= high) {
            final int mid = (low + high) >>> 1;
            if (LOWER_BOUNDS[mid] <= zoom) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return LEVELS[found];
    }

    /**
     * Detects a level change between two zoom values.
     *
     * @return The level of {@code nextZoom}, or empty if both zooms map to the same level.
     */
    public Optional<DetailLevel> crossedBoundary(final double previousZoom, final double nextZoom) {
        final DetailLevel previous = levelFor(previousZoom);
        final DetailLevel next = levelFor(nextZoom);
        return previous == next ? Optional.empty() : Optional.of(next);
    }

    /**
     * Level used for the active cell: one above the zoom level, saturating at the top.
     */
    public DetailLevel boostedLevel(final double zoom) {
        return levelFor(zoom).next();
    }

    public DetailLevel levelForFocused() {
        return DetailLevel.max();
    }
}
