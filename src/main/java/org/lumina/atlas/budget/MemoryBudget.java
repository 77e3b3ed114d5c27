package org.lumina.atlas.budget;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits that apply to one round of atlas generation.
 * <p>
 * Recomputed whenever memory pressure changes and read by the distribution strategist and
 * the worker pool. A budget without sizes or workers is <em>exhausted</em>; the coordinator
 * replaces it with {@link #degraded(int)} rather than failing.
 *
 * @param byteCeiling  Bytes the atlas set of one generation may occupy.
 * @param parallelism  Number of atlases assembled concurrently.
 * @param allowedSizes Atlas edge lengths, ascending.
 */
public record MemoryBudget(long byteCeiling, int parallelism, List<Integer> allowedSizes) {

    private static final long BYTES_PER_PIXEL = 4;

    public MemoryBudget {
        if (byteCeiling < 0) {
            throw new IllegalArgumentException("Byte ceiling must not be negative, got " + byteCeiling);
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must not be negative, got " + parallelism);
        }
        allowedSizes = allowedSizes.stream().distinct().sorted().toList();
        for (final int size : allowedSizes) {
            if (size <= 0) {
                throw new IllegalArgumentException("Atlas sizes must be positive, got " + size);
            }
        }
    }

    /**
     * Single smallest size, one worker, ceiling of exactly one atlas of that size.
     */
    public static MemoryBudget degraded(int size) {
        return new MemoryBudget(bytesFor(size), 1, List.of(size));
    }

    public static long bytesFor(int atlasSize) {
        return (long) atlasSize * atlasSize * BYTES_PER_PIXEL;
    }

    public boolean isExhausted() {
        return parallelism <= 0 || allowedSizes.isEmpty();
    }

    public int smallestSize() {
        requireSizes();
        return allowedSizes.get(0);
    }

    public int largestSize() {
        requireSizes();
        return allowedSizes.get(allowedSizes.size() - 1);
    }

    /**
     * Allowed sizes whose buffer alone fits the ceiling, ascending. The smallest allowed size
     * is always kept so there is something to generate into.
     */
    public List<Integer> usableSizes() {
        requireSizes();
        final List<Integer> usable = new ArrayList<>();
        for (final int size : allowedSizes) {
            if (bytesFor(size) <= byteCeiling) {
                usable.add(size);
            }
        }
        if (usable.isEmpty()) {
            usable.add(allowedSizes.get(0));
        }
        return List.copyOf(usable);
    }

    private void requireSizes() {
        if (allowedSizes.isEmpty()) {
            throw new IllegalStateException("Budget has no allowed atlas sizes");
        }
    }

    @Override
    public String toString() {
        return String.format("MemoryBudget[ceiling=%s, parallelism=%d, sizes=%s]",
            MemoryEstimate.formatBytes(byteCeiling), parallelism, allowedSizes);
    }
}
