package org.lumina.atlas.distribution;

/**
 * How images were spread over atlases in a {@link DistributionPlan}.
 */
public enum DistributionPolicy {

    /** Only one atlas size is usable; images fill as many instances as needed. */
    SINGLE_SIZE,

    /** Several sizes, filled in a level-dependent order. */
    MULTI_SIZE,

    /** The focused image gets its own atlas at the maximum level, the rest use {@link #MULTI_SIZE}. */
    PRIORITY_BASED
}
