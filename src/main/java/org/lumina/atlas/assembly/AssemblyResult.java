package org.lumina.atlas.assembly;

import java.util.List;

import org.lumina.atlas.model.Atlas;

/**
 * Outcome of assembling one atlas.
 *
 * @param atlas  The composed atlas. Contains a region for every successfully drawn image.
 * @param failed Identifiers whose raster was missing or unusable. Their rectangles stay transparent.
 */
public record AssemblyResult(Atlas atlas, List<String> failed) {

    public AssemblyResult {
        failed = List.copyOf(failed);
    }
}
