package org.lumina.atlas.regeneration;

/**
 * What a new viewport state requires.
 */
public enum RegenerationDecision {

    /** Regenerate the visible (and active/focused) atlases. */
    FULL,

    /** Regenerate only the focused atlas. */
    SELECTIVE,

    /** Keep everything. */
    NONE
}
