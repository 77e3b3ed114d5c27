package org.lumina.atlas.regeneration;

/**
 * Maps a {@link RegenerationState} to a {@link RegenerationDecision}.
 * <p>
 * Rules in order: no atlas → FULL; invalidated cache → FULL; visible set changed or level
 * boundary crossed → FULL; only the focus changed → SELECTIVE; otherwise NONE.
 */
public class RegenerationDecider {

    public RegenerationDecision decide(RegenerationState state) {
        if (!state.atlasExists()) {
            return RegenerationDecision.FULL;
        }
        if (state.cacheInvalidated()) {
            return RegenerationDecision.FULL;
        }
        if (state.visibleSetChanged() || state.lodBoundaryCrossed()) {
            return RegenerationDecision.FULL;
        }
        if (state.focusChanged()) {
            return RegenerationDecision.SELECTIVE;
        }
        return RegenerationDecision.NONE;
    }
}
