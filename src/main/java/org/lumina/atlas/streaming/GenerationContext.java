package org.lumina.atlas.streaming;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import org.lumina.atlas.api.IPhotoLoader;
import org.lumina.atlas.assembly.AtlasAssembler;
import org.lumina.atlas.distribution.DistributionStrategist;
import org.lumina.atlas.packing.ShelfPacker;

/**
 * Collaborators shared by all {@link LevelGenerationTask}s of one coordinator.
 */
record GenerationContext(
    IPhotoLoader loader,
    DistributionStrategist strategist,
    ShelfPacker packer,
    AtlasAssembler assembler,
    AtlasCache cache,
    FailedPhotoRegistry failedPhotos,
    ExecutorService workers,
    Consumer<AtlasEvent> events,
    Duration decodeTimeout,
    int decodeRetries
) {
}
