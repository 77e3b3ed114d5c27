package org.lumina.atlas.streaming;

import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.AtlasRegion;

/**
 * Where a photo can be drawn from: the atlas buffer and the source rectangle inside it.
 */
public record RegionLookup(Atlas atlas, AtlasRegion region) {
}
