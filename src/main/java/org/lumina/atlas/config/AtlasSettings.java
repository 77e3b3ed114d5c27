package org.lumina.atlas.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.lumina.atlas.budget.DeviceCapabilities;
import org.lumina.atlas.budget.DeviceTier;
import org.lumina.atlas.budget.MemoryBudgetCalculator.TierProfile;
import org.lumina.atlas.budget.PressureLevel;
import org.lumina.atlas.budget.PressureThresholds;
import org.lumina.atlas.distribution.DistributionStrategist;
import org.lumina.atlas.model.DetailLevel;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code lumina.atlas} configuration block.
 * <p>
 * Every key has a built-in default, so an empty {@link Config} yields a working setup.
 *
 * @param maxTextureSize     Largest texture edge the renderer accepts.
 * @param maxMemoryMb        Memory available to the pipeline in MiB, 0 to use the JVM max heap.
 * @param tierProfiles       Budget starting point per device tier.
 * @param pressureThresholds Usage fractions at which MEDIUM, HIGH and CRITICAL pressure start.
 * @param degradedAtlasSize  Atlas size used when a budget is exhausted.
 * @param distribution       Packing padding and multi-size rules.
 * @param decodeTimeout      Maximum wait for a single photo decode.
 * @param decodeRetries      Extra attempts for retryable decode failures.
 * @param visibleWindow      Number of visible levels kept in the cache.
 * @param shutdownTimeout    Maximum wait for workers on close.
 * @param failedPhotoTtl     How long a non-retryable decode failure is remembered.
 * @param failedPhotoMaxSize Maximum number of remembered failures.
 */
public record AtlasSettings(
    int maxTextureSize,
    long maxMemoryMb,
    Map<DeviceTier, TierProfile> tierProfiles,
    PressureThresholds pressureThresholds,
    int degradedAtlasSize,
    DistributionStrategist.Options distribution,
    Duration decodeTimeout,
    int decodeRetries,
    int visibleWindow,
    Duration shutdownTimeout,
    Duration failedPhotoTtl,
    long failedPhotoMaxSize
) {

    private static final Config DEFAULTS = ConfigFactory.parseMap(defaultValues());

    public AtlasSettings {
        if (maxTextureSize <= 0) {
            throw new IllegalArgumentException("device.max-texture-size must be positive, got " + maxTextureSize);
        }
        if (maxMemoryMb < 0) {
            throw new IllegalArgumentException("device.max-memory-mb must not be negative, got " + maxMemoryMb);
        }
        if (degradedAtlasSize <= 0) {
            throw new IllegalArgumentException("budget.degraded-size must be positive, got " + degradedAtlasSize);
        }
        if (decodeTimeout.isNegative() || decodeTimeout.isZero()) {
            throw new IllegalArgumentException("streaming.decode-timeout must be positive");
        }
        if (decodeRetries < 0) {
            throw new IllegalArgumentException("streaming.decode-retries must not be negative, got " + decodeRetries);
        }
        if (visibleWindow < 1) {
            throw new IllegalArgumentException("streaming.visible-window must be at least 1, got " + visibleWindow);
        }
        if (failedPhotoMaxSize < 0) {
            throw new IllegalArgumentException("failed-photos.maximum-size must not be negative");
        }
        tierProfiles = Map.copyOf(tierProfiles);
    }

    /**
     * Settings built from the defaults alone.
     */
    public static AtlasSettings defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Parses a {@code lumina.atlas} block. Missing keys fall back to the defaults.
     *
     * @throws IllegalArgumentException if a value has the wrong type or is out of range.
     */
    public static AtlasSettings fromConfig(final Config atlasConfig) {
        final Config config = atlasConfig.withFallback(DEFAULTS);
        try {
            final Map<DeviceTier, TierProfile> profiles = new EnumMap<>(DeviceTier.class);
            for (final DeviceTier tier : DeviceTier.values()) {
                final Config tierConfig = config.getConfig("budget." + tier.name().toLowerCase(Locale.ROOT));
                profiles.put(tier, new TierProfile(
                    tierConfig.getIntList("sizes"),
                    tierConfig.getInt("parallelism"),
                    tierConfig.getLong("ceiling-mb") * 1024L * 1024L));
            }

            final List<Integer> minImages = config.getIntList("distribution.min-images");
            if (minImages.size() != DetailLevel.values().length) {
                throw new IllegalArgumentException(String.format(
                    "distribution.min-images needs %d entries (one per level), got %d",
                    DetailLevel.values().length, minImages.size()));
            }
            final Map<DetailLevel, Integer> minPerLevel = new EnumMap<>(DetailLevel.class);
            for (final DetailLevel level : DetailLevel.values()) {
                minPerLevel.put(level, minImages.get(level.ordinal()));
            }
            final DistributionStrategist.Options distribution = new DistributionStrategist.Options(
                config.getInt("packing.padding"),
                config.getEnum(DetailLevel.class, "distribution.largest-first-from"),
                minPerLevel);

            return new AtlasSettings(
                config.getInt("device.max-texture-size"),
                config.getLong("device.max-memory-mb"),
                profiles,
                new PressureThresholds(
                    config.getDouble("pressure.medium-threshold"),
                    config.getDouble("pressure.high-threshold"),
                    config.getDouble("pressure.critical-threshold")),
                config.getInt("budget.degraded-size"),
                distribution,
                config.getDuration("streaming.decode-timeout"),
                config.getInt("streaming.decode-retries"),
                config.getInt("streaming.visible-window"),
                config.getDuration("streaming.shutdown-timeout"),
                config.getDuration("failed-photos.expire-after-write"),
                config.getLong("failed-photos.maximum-size"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid atlas configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Classifies a heap usage fraction with the configured thresholds.
     */
    public PressureLevel pressureFor(final double usage) {
        return pressureThresholds.classify(usage);
    }

    /**
     * Device capabilities from the configured figures, detecting memory when it is 0.
     */
    public DeviceCapabilities capabilities() {
        return maxMemoryMb > 0
            ? new DeviceCapabilities(maxMemoryMb, maxTextureSize)
            : DeviceCapabilities.detect(maxTextureSize);
    }

    private static Map<String, Object> defaultValues() {
        final Map<String, Object> values = new HashMap<>();
        values.put("device.max-texture-size", 8192);
        values.put("device.max-memory-mb", 0);
        values.put("budget.low.sizes", List.of(2048));
        values.put("budget.low.parallelism", 2);
        values.put("budget.low.ceiling-mb", 200);
        values.put("budget.medium.sizes", List.of(2048, 4096));
        values.put("budget.medium.parallelism", 4);
        values.put("budget.medium.ceiling-mb", 300);
        values.put("budget.high.sizes", List.of(2048, 4096, 8192));
        values.put("budget.high.parallelism", 6);
        values.put("budget.high.ceiling-mb", 400);
        values.put("budget.degraded-size", 2048);
        values.put("pressure.medium-threshold", 0.80);
        values.put("pressure.high-threshold", 0.90);
        values.put("pressure.critical-threshold", 0.98);
        values.put("packing.padding", 2);
        values.put("distribution.largest-first-from", "LEVEL_5");
        values.put("distribution.min-images", List.of(4, 4, 3, 3, 2, 1, 1, 1));
        values.put("streaming.decode-timeout", "5s");
        values.put("streaming.decode-retries", 1);
        values.put("streaming.visible-window", 2);
        values.put("streaming.shutdown-timeout", "5s");
        values.put("failed-photos.expire-after-write", "10m");
        values.put("failed-photos.maximum-size", 10000);
        return values;
    }
}
