package org.lumina.atlas.budget;

/**
 * Coarse device performance class. Selects the atlas sizes, worker parallelism and memory
 * ceiling the pipeline may use.
 */
public enum DeviceTier {
    LOW,
    MEDIUM,
    HIGH
}
