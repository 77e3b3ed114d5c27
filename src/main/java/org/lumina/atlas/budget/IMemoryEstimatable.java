package org.lumina.atlas.budget;

import java.util.List;

/**
 * Component that can report the memory it holds.
 * <p>
 * The atlas cache and the coordinator implement it so an embedding application can see how
 * much memory the pipeline holds. The coordinator also logs its estimate at debug level
 * after each completed submission.
 */
public interface IMemoryEstimatable {

    /**
     * @return One estimate per logical part of the component, never null.
     */
    List<MemoryEstimate> estimateMemory();

    /**
     * Sum of all estimates of this component.
     */
    default long totalEstimatedBytes() {
        return estimateMemory().stream().mapToLong(MemoryEstimate::estimatedBytes).sum();
    }
}
