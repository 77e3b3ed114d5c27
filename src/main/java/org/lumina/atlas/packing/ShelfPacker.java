package org.lumina.atlas.packing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.lumina.atlas.model.PackedRect;
import org.lumina.atlas.model.PlanImage;

/**
 * Shelf bin packer for square atlases.
 * <p>
 * Images are sorted by height (descending, stable) and placed left to right on horizontal
 * shelves. Each image occupies a slot of {@code (w + 2p) × (h + 2p)}; the image itself sits
 * at slot origin + padding, so the padded rectangles of two neighbours never intersect.
 * An image goes onto the first shelf (in creation order) that is tall enough and has enough
 * remaining width. Otherwise a new shelf is opened below the last one, if the atlas still
 * has room. Images are never rotated.
 * <p>
 * This class is stateless and thread-safe. Identical inputs always produce identical
 * placements.
 */
public class ShelfPacker {

    /**
     * Packs images into a single atlas.
     *
     * @param images    Images in caller order. Ties in height keep this order.
     * @param atlasSize Atlas edge length in pixels.
     * @param padding   Margin kept around every image.
     * @return Placements, rejected images and utilization.
     * @throws IllegalArgumentException if {@code atlasSize <= 0} or {@code padding < 0}.
     */
    public PackResult pack(final List<PlanImage> images, final int atlasSize, final int padding) {
        if (atlasSize <= 0) {
            throw new IllegalArgumentException("Atlas size must be positive, got " + atlasSize);
        }
        if (padding < 0) {
            throw new IllegalArgumentException("Padding must not be negative, got " + padding);
        }

        // List.sort is stable
        final List<PlanImage> sorted = new ArrayList<>(images);
        sorted.sort(Comparator.comparingInt(PlanImage::height).reversed());

        final List<Shelf> shelves = new ArrayList<>();
        final List<PackedRect> placed = new ArrayList<>(sorted.size());
        final List<PlanImage> rejected = new ArrayList<>();
        final int maxInner = atlasSize - 2 * padding;
        int nextShelfY = 0;
        long usedArea = 0;

        for (final PlanImage image : sorted) {
            if (image.width() > maxInner || image.height() > maxInner) {
                rejected.add(image);
                continue;
            }
            final int slotWidth = image.width() + 2 * padding;
            final int slotHeight = image.height() + 2 * padding;

            Shelf target = null;
            for (final Shelf shelf : shelves) {
                if (shelf.fits(slotWidth, slotHeight)) {
                    target = shelf;
                    break;
                }
            }
            if (target == null) {
                if (nextShelfY + slotHeight > atlasSize) {
                    rejected.add(image);
                    continue;
                }
                target = new Shelf(nextShelfY, slotHeight, atlasSize);
                shelves.add(target);
                nextShelfY += slotHeight;
            }

            final int slotX = target.take(slotWidth);
            placed.add(new PackedRect(image.id(), slotX + padding, target.y + padding,
                image.width(), image.height()));
            usedArea += image.area();
        }

        final double utilization = (double) usedArea / ((double) atlasSize * atlasSize);
        return new PackResult(atlasSize, placed, rejected, utilization);
    }

    /**
     * One horizontal strip. Its height is fixed by the first slot placed on it.
     */
    private static final class Shelf {
        private final int y;
        private final int height;
        private final int atlasWidth;
        private int cursorX;

        Shelf(final int y, final int height, final int atlasWidth) {
            this.y = y;
            this.height = height;
            this.atlasWidth = atlasWidth;
        }

        boolean fits(final int slotWidth, final int slotHeight) {
            return slotHeight <= height && cursorX + slotWidth <= atlasWidth;
        }

        int take(final int slotWidth) {
            final int x = cursorX;
            cursorX += slotWidth;
            return x;
        }
    }
}
