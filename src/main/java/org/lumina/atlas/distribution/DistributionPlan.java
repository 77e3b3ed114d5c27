package org.lumina.atlas.distribution;

import java.util.List;

import org.lumina.atlas.model.PlanImage;

/**
 * Result of {@link DistributionStrategist#plan}.
 *
 * @param policy            Rule that produced the plan.
 * @param entries           Atlases to generate, focused entries first.
 * @param permanentlyFailed Images larger than the largest usable atlas.
 */
public record DistributionPlan(DistributionPolicy policy, List<AtlasPlanEntry> entries,
                               List<PlanImage> permanentlyFailed) {

    public DistributionPlan {
        entries = List.copyOf(entries);
        permanentlyFailed = List.copyOf(permanentlyFailed);
    }

    public int plannedImageCount() {
        return entries.stream().mapToInt(entry -> entry.members().size()).sum();
    }

    public long totalBytes() {
        return entries.stream().mapToLong(AtlasPlanEntry::memoryBytes).sum();
    }

    public List<String> permanentlyFailedIds() {
        return permanentlyFailed.stream().map(PlanImage::id).toList();
    }
}
