package org.lumina.atlas.regeneration;

/**
 * Differences between the previous and the new viewport state, as seen by the coordinator.
 *
 * @param atlasExists        At least one non-persistent atlas is cached.
 * @param visibleSetChanged  The visible (or active) id set differs.
 * @param lodBoundaryCrossed The zoom moved into another detail level.
 * @param cacheInvalidated   A cached atlas was reclaimed externally.
 * @param focusChanged       The focused id differs.
 */
public record RegenerationState(boolean atlasExists, boolean visibleSetChanged, boolean lodBoundaryCrossed,
                                boolean cacheInvalidated, boolean focusChanged) {
}
