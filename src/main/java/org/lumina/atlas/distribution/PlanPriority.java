package org.lumina.atlas.distribution;

/**
 * Generation priority of one planned atlas.
 */
public enum PlanPriority {
    STANDARD,
    FOCUSED
}
