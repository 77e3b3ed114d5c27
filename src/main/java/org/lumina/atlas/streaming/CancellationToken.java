package org.lumina.atlas.streaming;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by one generation task and its work items.
 * <p>
 * Futures registered with the token are cancelled (with interruption) together with it,
 * so in-flight decodes and entry assemblies stop early.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Future<?>> registered = ConcurrentHashMap.newKeySet();

    /**
     * @return true if this call cancelled the token.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Future<?> future : registered) {
            future.cancel(true);
        }
        registered.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if the token was cancelled.
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Generation task was superseded");
        }
    }

    /**
     * Ties a future to this token. A future registered after cancellation is cancelled at once.
     */
    public void register(Future<?> future) {
        registered.add(future);
        if (cancelled.get()) {
            registered.remove(future);
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        registered.remove(future);
    }
}
