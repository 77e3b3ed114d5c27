package org.lumina.atlas.distribution;

import java.util.List;

import org.lumina.atlas.model.DetailLevel;
import org.lumina.atlas.model.PlanImage;

/**
 * One atlas to be generated.
 *
 * @param size        Atlas edge length.
 * @param members     Images packed into it, sized for {@code detailLevel}.
 * @param priority    Generation priority.
 * @param detailLevel Level the members are sized for.
 */
public record AtlasPlanEntry(int size, List<PlanImage> members, PlanPriority priority, DetailLevel detailLevel) {

    public AtlasPlanEntry {
        members = List.copyOf(members);
    }

    public List<String> memberIds() {
        return members.stream().map(PlanImage::id).toList();
    }

    public long memoryBytes() {
        return (long) size * size * 4;
    }
}
