package org.lumina.atlas.streaming;

import java.util.List;

import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.DetailLevel;

/**
 * Events emitted by {@link StreamingAtlasCoordinator}.
 * <p>
 * Every event carries the sequence of the submission that caused it. For one task the
 * order is {@link Loading}, zero or more {@link Progress}, then exactly one of
 * {@link LevelReady} or {@link LevelFailed} (nothing further if the task was cancelled).
 */
public sealed interface AtlasEvent {

    long sequence();

    record Loading(long sequence, DetailLevel level, AtlasClass atlasClass) implements AtlasEvent {
    }

    /**
     * @param fraction Completed plan entries / all plan entries, in {@code (0, 1]}.
     */
    record Progress(long sequence, DetailLevel level, AtlasClass atlasClass, double fraction) implements AtlasEvent {
    }

    /**
     * @param atlases   The atlases now cached for the level and class.
     * @param failedIds Images that could not be included (decode failures, oversize).
     */
    record LevelReady(long sequence, DetailLevel level, AtlasClass atlasClass, List<Atlas> atlases,
                      List<String> failedIds) implements AtlasEvent {
        public LevelReady {
            atlases = List.copyOf(atlases);
            failedIds = List.copyOf(failedIds);
        }
    }

    record LevelFailed(long sequence, DetailLevel level, AtlasClass atlasClass, String reason) implements AtlasEvent {
    }

    /**
     * @param totalAtlases Atlases produced by the submission's completed tasks.
     */
    record AllComplete(long sequence, int totalAtlases) implements AtlasEvent {
    }

    /**
     * Atlases were dropped from the cache (focus cleared, rolling window, memory pressure).
     */
    record AtlasRemoved(long sequence, DetailLevel level, AtlasClass atlasClass, int count) implements AtlasEvent {
    }
}
