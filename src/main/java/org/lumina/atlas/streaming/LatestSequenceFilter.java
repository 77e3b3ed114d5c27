package org.lumina.atlas.streaming;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Listener wrapper that drops {@link AtlasEvent.LevelReady} events older than one already
 * delivered for the same level and class. All other events pass through.
 */
public class LatestSequenceFilter implements IAtlasEventListener {

    private final IAtlasEventListener delegate;
    private final Map<TaskKey, Long> latest = new ConcurrentHashMap<>();

    public LatestSequenceFilter(IAtlasEventListener delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onEvent(AtlasEvent event) {
        if (event instanceof AtlasEvent.LevelReady ready) {
            TaskKey key = new TaskKey(ready.level(), ready.atlasClass());
            boolean[] accepted = new boolean[1];
            latest.compute(key, (k, seen) -> {
                if (seen != null && ready.sequence() < seen) {
                    return seen;
                }
                accepted[0] = true;
                return ready.sequence();
            });
            if (!accepted[0]) {
                return;
            }
        }
        delegate.onEvent(event);
    }
}
