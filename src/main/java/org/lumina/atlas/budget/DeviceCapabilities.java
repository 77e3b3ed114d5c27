package org.lumina.atlas.budget;

/**
 * What the host can offer to atlas generation.
 * <p>
 * Classification:
 * <ul>
 *   <li>{@link DeviceTier#HIGH}: at least 2048 MB of memory and textures of 8192 px</li>
 *   <li>{@link DeviceTier#MEDIUM}: at least 1024 MB of memory and textures of 4096 px</li>
 *   <li>{@link DeviceTier#LOW}: everything else</li>
 * </ul>
 *
 * @param maxMemoryMb    Memory available to the process, in MiB.
 * @param maxTextureSize Largest texture edge the renderer accepts, in pixels.
 */
public record DeviceCapabilities(long maxMemoryMb, int maxTextureSize) {

    private static final long HIGH_MEMORY_MB = 2048;
    private static final long MEDIUM_MEMORY_MB = 1024;
    private static final int HIGH_TEXTURE = 8192;
    private static final int MEDIUM_TEXTURE = 4096;

    public DeviceCapabilities {
        if (maxMemoryMb < 0) {
            throw new IllegalArgumentException("Memory must not be negative, got " + maxMemoryMb);
        }
        if (maxTextureSize <= 0) {
            throw new IllegalArgumentException("Max texture size must be positive, got " + maxTextureSize);
        }
    }

    /**
     * Uses the JVM's maximum heap as the memory figure.
     */
    public static DeviceCapabilities detect(int maxTextureSize) {
        return new DeviceCapabilities(Runtime.getRuntime().maxMemory() / (1024 * 1024), maxTextureSize);
    }

    public DeviceTier tier() {
        if (maxMemoryMb >= HIGH_MEMORY_MB && maxTextureSize >= HIGH_TEXTURE) {
            return DeviceTier.HIGH;
        }
        if (maxMemoryMb >= MEDIUM_MEMORY_MB && maxTextureSize >= MEDIUM_TEXTURE) {
            return DeviceTier.MEDIUM;
        }
        return DeviceTier.LOW;
    }
}
