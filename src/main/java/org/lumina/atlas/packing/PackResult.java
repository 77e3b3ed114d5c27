package org.lumina.atlas.packing;

import java.util.List;

import org.lumina.atlas.model.PackedRect;
import org.lumina.atlas.model.PlanImage;

/**
 * Outcome of one {@link ShelfPacker#pack} call.
 *
 * @param atlasSize   Edge length of the atlas the images were packed into.
 * @param placed      Placements in packing order (height-descending).
 * @param rejected    Images that did not fit, in packing order.
 * @param utilization Sum of placed image areas divided by {@code atlasSize²}.
 */
public record PackResult(int atlasSize, List<PackedRect> placed, List<PlanImage> rejected, double utilization) {

    public PackResult {
        placed = List.copyOf(placed);
        rejected = List.copyOf(rejected);
    }

    public boolean isEmpty() {
        return placed.isEmpty();
    }

    public boolean allPlaced() {
        return rejected.isEmpty();
    }
}
