package org.lumina.atlas.streaming;

import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.DetailLevel;

/**
 * Identifies one independent generation stream. A newer submission only cancels
 * in-flight work with the same key.
 */
public record TaskKey(DetailLevel level, AtlasClass atlasClass) {

    @Override
    public String toString() {
        return atlasClass + "@" + level;
    }
}
