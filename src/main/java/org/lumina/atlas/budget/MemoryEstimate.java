package org.lumina.atlas.budget;

/**
 * Memory held by one part of the atlas pipeline.
 * <p>
 * <strong>Example:</strong>
 * <pre>
 * MemoryEstimate estimate = new MemoryEstimate(
 *     "atlas-cache/VISIBLE",
 *     134_217_728L,  // 128 MB
 *     "2 atlases × 4096² × 4B",
 *     Category.STREAMED_ATLASES
 * );
 * </pre>
 *
 * @param componentName  The name of the component (e.g., "atlas-cache/PERSISTENT").
 * @param estimatedBytes Bytes held, or the worst case for in-flight work.
 * @param explanation    Human-readable explanation of how the estimate was calculated.
 * @param category       The category of memory usage for grouping in reports.
 */
public record MemoryEstimate(
    String componentName,
    long estimatedBytes,
    String explanation,
    Category category
) {

    /**
     * Category of memory usage for grouping and reporting.
     */
    public enum Category {
        /**
         * Lowest-level atlases covering the whole catalog. Never trimmed.
         */
        PERSISTENT_ATLASES("Persistent Atlases"),

        /**
         * Visible, active and focused atlases. Trimmed under pressure.
         */
        STREAMED_ATLASES("Streamed Atlases"),

        /**
         * Buffers of atlases being assembled.
         * Peak: parallelism × largest allowed size² × 4B.
         */
        IN_FLIGHT("In-Flight Assembly");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public static MemoryEstimate of(String componentName, long estimatedBytes, Category category) {
        return new MemoryEstimate(componentName, estimatedBytes, formatBytes(estimatedBytes), category);
    }

    public String formattedBytes() {
        return formatBytes(estimatedBytes);
    }

    /**
     * Formats bytes as human-readable string (KB, MB, GB).
     */
    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        } else if (bytes < 1024 * 1024) {
            return String.format("%.1f KB", bytes / 1024.0);
        } else if (bytes < 1024 * 1024 * 1024) {
            return String.format("%.1f MB", bytes / (1024.0 * 1024));
        } else {
            return String.format("%.2f GB", bytes / (1024.0 * 1024 * 1024));
        }
    }

    @Override
    public String toString() {
        return String.format("%s → %s: %s", componentName, formattedBytes(), explanation);
    }
}
