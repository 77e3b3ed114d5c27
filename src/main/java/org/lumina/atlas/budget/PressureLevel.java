package org.lumina.atlas.budget;

/**
 * Memory pressure reported by the host. Each level scales the tier's byte ceiling by a
 * factor that never grows with pressure.
 */
public enum PressureLevel {

    NORMAL(1.0),
    MEDIUM(0.75),
    /** Also halves worker parallelism. */
    HIGH(0.5),
    /** Also restricts generation to the smallest size and one worker. */
    CRITICAL(0.25);

    public static final double DEFAULT_MEDIUM_THRESHOLD = 0.80;
    public static final double DEFAULT_HIGH_THRESHOLD = 0.90;
    public static final double DEFAULT_CRITICAL_THRESHOLD = 0.98;

    private final double ceilingFactor;

    PressureLevel(double ceilingFactor) {
        this.ceilingFactor = ceilingFactor;
    }

    public double ceilingFactor() {
        return ceilingFactor;
    }

    /**
     * Classifies a heap usage fraction with the default thresholds.
     *
     * @param usage Used / max memory, in {@code [0, 1]}.
     */
    public static PressureLevel fromUsage(double usage) {
        return fromUsage(usage, DEFAULT_MEDIUM_THRESHOLD, DEFAULT_HIGH_THRESHOLD, DEFAULT_CRITICAL_THRESHOLD);
    }

    /**
     * Classifies a usage fraction. Each threshold is the inclusive lower bound of its level.
     */
    public static PressureLevel fromUsage(double usage, double mediumThreshold, double highThreshold,
                                          double criticalThreshold) {
        if (usage < mediumThreshold) {
            return NORMAL;
        }
        if (usage < highThreshold) {
            return MEDIUM;
        }
        if (usage < criticalThreshold) {
            return HIGH;
        }
        return CRITICAL;
    }
}
