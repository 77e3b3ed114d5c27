package org.lumina.atlas.model;

/**
 * Cache class an atlas belongs to. Lookups prefer classes in reverse declaration order
 * (focused first, persistent last).
 */
public enum AtlasClass {

    /** Every known photo at the lowest level. Built once, never evicted. */
    PERSISTENT,

    /** Photos in the visible set at the zoom-derived level. */
    VISIBLE,

    /** Photos of the active cell, one level above the visible level. */
    ACTIVE,

    /** The focused photo at the maximum level. */
    FOCUSED
}
