package org.lumina.atlas.budget;

/**
 * Usage fractions at which each elevated {@link PressureLevel} starts.
 *
 * @param medium   Lower bound of {@link PressureLevel#MEDIUM}.
 * @param high     Lower bound of {@link PressureLevel#HIGH}.
 * @param critical Lower bound of {@link PressureLevel#CRITICAL}.
 */
public record PressureThresholds(double medium, double high, double critical) {

    public PressureThresholds {
        if (!(medium <= high && high <= critical)) {
            throw new IllegalArgumentException(String.format(
                "Pressure thresholds must be ascending, got %.2f / %.2f / %.2f", medium, high, critical));
        }
    }

    public static PressureThresholds defaults() {
        return new PressureThresholds(PressureLevel.DEFAULT_MEDIUM_THRESHOLD, PressureLevel.DEFAULT_HIGH_THRESHOLD,
            PressureLevel.DEFAULT_CRITICAL_THRESHOLD);
    }

    public PressureLevel classify(double usage) {
        return PressureLevel.fromUsage(usage, medium, high, critical);
    }
}
