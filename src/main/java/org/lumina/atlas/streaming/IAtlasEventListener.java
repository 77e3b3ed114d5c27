package org.lumina.atlas.streaming;

/**
 * Receives pipeline events.
 * <p>
 * Called from pipeline threads; implementations must be thread-safe and should return
 * quickly. Exceptions thrown here are logged and do not affect generation.
 */
@FunctionalInterface
public interface IAtlasEventListener {
    void onEvent(AtlasEvent event);
}
