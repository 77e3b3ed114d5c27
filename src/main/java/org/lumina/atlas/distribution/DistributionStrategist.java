package org.lumina.atlas.distribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.lumina.atlas.budget.MemoryBudget;
import org.lumina.atlas.model.DetailLevel;
import org.lumina.atlas.model.PlanImage;
import org.lumina.atlas.packing.PackResult;
import org.lumina.atlas.packing.ShelfPacker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how many atlases of which sizes a set of images needs.
 * <p>
 * Only sizes whose buffer fits the budget's byte ceiling are used (the smallest allowed
 * size is always usable). Rules, first match wins:
 * <ol>
 *   <li>One usable size: {@link DistributionPolicy#SINGLE_SIZE}.</li>
 *   <li>A focused image among the inputs: {@link DistributionPolicy#PRIORITY_BASED}. The
 *       focused image is re-sized for the maximum level and planned alone into the largest
 *       usable size; the rest are distributed as for MULTI_SIZE.</li>
 *   <li>Otherwise {@link DistributionPolicy#MULTI_SIZE}: sizes are tried largest-first at
 *       high levels and smallest-first below. An atlas is only opened at a size when it
 *       would hold the level's minimum image count, except at the last size tried.</li>
 * </ol>
 * Whatever is still unplaced climbs the usable sizes from the smallest up, accepting any
 * non-empty atlas. An image only ends up in {@link DistributionPlan#permanentlyFailed()}
 * when it does not fit an empty atlas of the largest usable size.
 * <p>
 * This class is stateless and thread-safe.
 */
public class DistributionStrategist {

    private static final Logger log = LoggerFactory.getLogger(DistributionStrategist.class);

    /**
     * Tuning knobs.
     *
     * @param padding          Margin passed to the packer.
     * @param largestFirstFrom Lowest level at which sizes are tried largest-first.
     * @param minImages        Minimum images an atlas must receive before the last size, per level.
     */
    public record Options(int padding, DetailLevel largestFirstFrom, Map<DetailLevel, Integer> minImages) {

        public Options {
            if (padding < 0) {
                throw new IllegalArgumentException("Padding must not be negative, got " + padding);
            }
            Map<DetailLevel, Integer> copy = new EnumMap<>(DetailLevel.class);
            copy.putAll(minImages);
            minImages = Collections.unmodifiableMap(copy);
        }

        /**
         * Padding 2, largest-first from LEVEL_5, minimum 4 images at LEVEL_0-1, 3 at
         * LEVEL_2-3, 2 at LEVEL_4 and 1 above.
         */
        public static Options defaults() {
            Map<DetailLevel, Integer> min = new EnumMap<>(DetailLevel.class);
            for (DetailLevel level : DetailLevel.values()) {
                int count;
                if (level.ordinal() <= DetailLevel.LEVEL_1.ordinal()) {
                    count = 4;
                } else if (level.ordinal() <= DetailLevel.LEVEL_3.ordinal()) {
                    count = 3;
                } else if (level == DetailLevel.LEVEL_4) {
                    count = 2;
                } else {
                    count = 1;
                }
                min.put(level, count);
            }
            return new Options(2, DetailLevel.LEVEL_5, min);
        }

        public int minImagesFor(DetailLevel level) {
            return minImages.getOrDefault(level, 1);
        }
    }

    private final ShelfPacker packer;
    private final Options options;

    public DistributionStrategist() {
        this(new ShelfPacker(), Options.defaults());
    }

    public DistributionStrategist(ShelfPacker packer, Options options) {
        this.packer = packer;
        this.options = options;
    }

    public Options options() {
        return options;
    }

    /**
     * Plans the atlases for one set of images.
     *
     * @param images    Images already sized for {@code level}.
     * @param level     Level the images are sized for.
     * @param focusedId Focused image id, or {@code null}.
     * @param budget    Current memory budget. Must not be exhausted.
     * @return The plan. Every input image is either in an entry or permanently failed.
     */
    public DistributionPlan plan(List<PlanImage> images, DetailLevel level, String focusedId, MemoryBudget budget) {
        if (budget.isExhausted()) {
            throw new IllegalArgumentException("Cannot plan with an exhausted budget: " + budget);
        }
        List<Integer> usable = budget.usableSizes();
        List<AtlasPlanEntry> entries = new ArrayList<>();
        List<PlanImage> failed = new ArrayList<>();
        DistributionPolicy policy;

        PlanImage focused = focusedId == null ? null : findById(images, focusedId);

        if (usable.size() == 1) {
            policy = DistributionPolicy.SINGLE_SIZE;
            List<PlanImage> rest = fill(images, usable.get(0), true, level, PlanPriority.STANDARD, entries);
            failed.addAll(escalate(rest, usable, level, entries));
        } else if (focused != null) {
            policy = DistributionPolicy.PRIORITY_BASED;
            PlanImage resized = focused.resizedFor(DetailLevel.max());
            int largest = usable.get(usable.size() - 1);
            List<PlanImage> leftover = fill(List.of(resized), largest, true, DetailLevel.max(),
                PlanPriority.FOCUSED, entries);
            failed.addAll(leftover);

            List<PlanImage> rest = new ArrayList<>(images);
            rest.remove(focused);
            failed.addAll(multiSize(rest, level, usable, entries));
        } else {
            policy = DistributionPolicy.MULTI_SIZE;
            failed.addAll(multiSize(images, level, usable, entries));
        }

        if (!failed.isEmpty()) {
            log.warn("{} image(s) exceed the largest usable atlas size {} at {}: {}",
                failed.size(), usable.get(usable.size() - 1), level,
                failed.stream().map(PlanImage::id).toList());
        }
        DistributionPlan plan = new DistributionPlan(policy, entries, failed);
        log.debug("Planned {} atlas(es) for {} image(s) at {} with {} ({} permanently failed)",
            entries.size(), images.size(), level, policy, failed.size());
        return plan;
    }

    private List<PlanImage> multiSize(List<PlanImage> images, DetailLevel level, List<Integer> usable,
                                      List<AtlasPlanEntry> entries) {
        List<Integer> order = new ArrayList<>(usable);
        if (level.isAtLeast(options.largestFirstFrom())) {
            Collections.reverse(order);
        }
        List<PlanImage> remaining = images;
        for (int i = 0; i < order.size() && !remaining.isEmpty(); i++) {
            boolean last = i == order.size() - 1;
            remaining = fill(remaining, order.get(i), last, level, PlanPriority.STANDARD, entries);
        }
        return escalate(remaining, usable, level, entries);
    }

    /**
     * Climbs the usable sizes from the smallest up, accepting any non-empty atlas.
     *
     * @return Images that do not fit the largest usable size.
     */
    private List<PlanImage> escalate(List<PlanImage> leftovers, List<Integer> usable, DetailLevel level,
                                     List<AtlasPlanEntry> entries) {
        List<PlanImage> remaining = leftovers;
        for (int i = 0; i < usable.size() && !remaining.isEmpty(); i++) {
            remaining = fill(remaining, usable.get(i), true, level, PlanPriority.STANDARD, entries);
        }
        return remaining;
    }

    /**
     * Opens atlases of one size until nothing more is placed or an atlas would be
     * under-filled.
     *
     * @param acceptAny Accept any non-empty atlas regardless of the level minimum.
     * @return Images not placed at this size.
     */
    private List<PlanImage> fill(List<PlanImage> images, int size, boolean acceptAny, DetailLevel level,
                                 PlanPriority priority, List<AtlasPlanEntry> entries) {
        int minimum = acceptAny ? 1 : options.minImagesFor(level);
        List<PlanImage> remaining = images;
        while (!remaining.isEmpty()) {
            PackResult result = packer.pack(remaining, size, options.padding());
            if (result.placed().size() < minimum || result.isEmpty()) {
                break;
            }
            entries.add(new AtlasPlanEntry(size, membersOf(result, remaining), priority, level));
            remaining = result.rejected();
        }
        return remaining;
    }

    private static List<PlanImage> membersOf(PackResult result, List<PlanImage> candidates) {
        Map<String, PlanImage> byId = new HashMap<>();
        for (PlanImage image : candidates) {
            byId.putIfAbsent(image.id(), image);
        }
        return result.placed().stream().map(rect -> byId.get(rect.id())).toList();
    }

    private static PlanImage findById(List<PlanImage> images, String id) {
        for (PlanImage image : images) {
            if (image.id().equals(id)) {
                return image;
            }
        }
        return null;
    }
}
