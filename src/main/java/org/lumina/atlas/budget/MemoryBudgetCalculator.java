package org.lumina.atlas.budget;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link MemoryBudget} from the device tier and the current memory pressure.
 * <p>
 * Pure and idempotent: the same inputs always yield an equal budget.
 * <ul>
 *   <li>The tier's base ceiling is scaled by {@link PressureLevel#ceilingFactor()}.</li>
 *   <li>{@link PressureLevel#HIGH} halves parallelism (at least 1).</li>
 *   <li>{@link PressureLevel#CRITICAL} keeps only the smallest size and one worker.</li>
 * </ul>
 */
public class MemoryBudgetCalculator {

    private static final long MIB = 1024L * 1024L;

    /**
     * Per-tier starting point before pressure scaling.
     *
     * @param allowedSizes     Atlas edge lengths the tier may use.
     * @param parallelism      Concurrent atlas assemblies.
     * @param baseCeilingBytes Byte ceiling at {@link PressureLevel#NORMAL}.
     */
    public record TierProfile(List<Integer> allowedSizes, int parallelism, long baseCeilingBytes) {
        public TierProfile {
            allowedSizes = List.copyOf(allowedSizes);
        }
    }

    private final Map<DeviceTier, TierProfile> profiles;

    /**
     * Uses the built-in profiles (LOW: 2048 / 2 / 200 MiB, MEDIUM: 2048+4096 / 4 / 300 MiB,
     * HIGH: 2048+4096+8192 / 6 / 400 MiB).
     */
    public MemoryBudgetCalculator() {
        this(defaultProfiles());
    }

    public MemoryBudgetCalculator(Map<DeviceTier, TierProfile> profiles) {
        for (DeviceTier tier : DeviceTier.values()) {
            if (!profiles.containsKey(tier)) {
                throw new IllegalArgumentException("Missing budget profile for tier " + tier);
            }
        }
        this.profiles = new EnumMap<>(profiles);
    }

    public static Map<DeviceTier, TierProfile> defaultProfiles() {
        Map<DeviceTier, TierProfile> profiles = new EnumMap<>(DeviceTier.class);
        profiles.put(DeviceTier.LOW, new TierProfile(List.of(2048), 2, 200 * MIB));
        profiles.put(DeviceTier.MEDIUM, new TierProfile(List.of(2048, 4096), 4, 300 * MIB));
        profiles.put(DeviceTier.HIGH, new TierProfile(List.of(2048, 4096, 8192), 6, 400 * MIB));
        return profiles;
    }

    public MemoryBudget computeBudget(DeviceTier tier, PressureLevel pressure) {
        return compute(profiles.get(tier), pressure, Integer.MAX_VALUE);
    }

    /**
     * Like {@link #computeBudget(DeviceTier, PressureLevel)} with the tier classified from
     * {@code capabilities} and sizes above its texture limit removed.
     */
    public MemoryBudget computeBudget(DeviceCapabilities capabilities, PressureLevel pressure) {
        return compute(profiles.get(capabilities.tier()), pressure, capabilities.maxTextureSize());
    }

    private MemoryBudget compute(TierProfile profile, PressureLevel pressure, int maxTextureSize) {
        List<Integer> sizes = new ArrayList<>();
        for (int size : profile.allowedSizes()) {
            if (size <= maxTextureSize) {
                sizes.add(size);
            }
        }
        sizes.sort(null);

        long ceiling = (long) (profile.baseCeilingBytes() * pressure.ceilingFactor());
        int parallelism = profile.parallelism();

        switch (pressure) {
            case HIGH -> parallelism = parallelism > 0 ? Math.max(1, parallelism / 2) : 0;
            case CRITICAL -> {
                parallelism = parallelism > 0 ? 1 : 0;
                if (!sizes.isEmpty()) {
                    sizes = List.of(sizes.get(0));
                }
            }
            default -> { }
        }
        return new MemoryBudget(ceiling, parallelism, sizes);
    }
}
