package org.lumina.atlas.streaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.lumina.atlas.budget.IMemoryEstimatable;
import org.lumina.atlas.budget.MemoryEstimate;
import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.AtlasRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the generated atlases per {@link TaskKey}.
 * <p>
 * <strong>Concurrency:</strong> all mutations run under one lock (single writer) and
 * publish a new immutable snapshot through a volatile field. Readers never block and
 * always see a complete set of atlases for a key; a regenerated set replaces the old one
 * in a single step.
 * <p>
 * <strong>Retention per class:</strong>
 * <ul>
 *   <li>{@link AtlasClass#VISIBLE}: the most recently installed levels, up to the window size</li>
 *   <li>{@link AtlasClass#ACTIVE}, {@link AtlasClass#FOCUSED}, {@link AtlasClass#PERSISTENT}: one level each</li>
 * </ul>
 * The persistent set is never touched by {@link #trimStreamedTo(long)}.
 * <p>
 * Every install carries the sequence of the submission that produced it. An install is
 * rejected when a newer sequence is already installed for the same key, or for the same
 * class when that class keeps a single level.
 */
public class AtlasCache implements IMemoryEstimatable {

    private static final Logger log = LoggerFactory.getLogger(AtlasCache.class);

    private static final List<AtlasClass> LOOKUP_ORDER = List.of(
        AtlasClass.FOCUSED, AtlasClass.ACTIVE, AtlasClass.VISIBLE, AtlasClass.PERSISTENT);

    /**
     * Atlases dropped from the cache for one key.
     */
    public record Eviction(TaskKey key, int count) {
    }

    /**
     * @param installed False if the token was cancelled before the install.
     * @param evicted   Keys dropped to make room under the retention rules.
     */
    public record InstallResult(boolean installed, List<Eviction> evicted) {
        static final InstallResult REJECTED = new InstallResult(false, List.of());
    }

    private final ReentrantLock writeLock = new ReentrantLock();
    private final int visibleWindow;

    /** Insertion order is install order. */
    private volatile Map<TaskKey, List<Atlas>> snapshot = Map.of();

    /** Sequence of the install that produced each cached key. Guarded by {@link #writeLock}. */
    private final Map<TaskKey, Long> installedSequences = new HashMap<>();

    public AtlasCache(int visibleWindow) {
        if (visibleWindow < 1) {
            throw new IllegalArgumentException("Visible window must be at least 1, got " + visibleWindow);
        }
        this.visibleWindow = visibleWindow;
    }

    /**
     * Replaces the atlases of {@code key}, unless {@code token} is already cancelled or a
     * newer submission has already installed into the same slot.
     *
     * @param sequence Sequence of the submission that produced {@code atlases}.
     */
    public InstallResult install(TaskKey key, long sequence, List<Atlas> atlases, CancellationToken token) {
        writeLock.lock();
        try {
            if (token.isCancelled()) {
                return InstallResult.REJECTED;
            }
            Optional<TaskKey> newer = newerInstall(key, sequence);
            if (newer.isPresent()) {
                log.debug("Rejecting {} (seq {}): {} holds seq {}", key, sequence, newer.get(),
                    installedSequences.get(newer.get()));
                return InstallResult.REJECTED;
            }
            Map<TaskKey, List<Atlas>> next = new LinkedHashMap<>(snapshot);
            next.remove(key);
            next.put(key, List.copyOf(atlases));

            List<Eviction> evicted = new ArrayList<>();
            int keep = key.atlasClass() == AtlasClass.VISIBLE ? visibleWindow : 1;
            List<TaskKey> sameClass = keysOf(next, key.atlasClass());
            for (int i = 0; i < sameClass.size() - keep; i++) {
                TaskKey old = sameClass.get(i);
                evicted.add(new Eviction(old, next.remove(old).size()));
            }
            installedSequences.put(key, sequence);
            publish(next);
            if (!evicted.isEmpty()) {
                log.debug("Installing {} evicted {}", key, evicted);
            }
            return new InstallResult(true, evicted);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Cancels {@code token} under the write lock, so a concurrent {@link #install} either
     * completed before or observes the cancellation.
     */
    public boolean revoke(CancellationToken token) {
        writeLock.lock();
        try {
            return token.cancel();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops every key of one class.
     */
    public List<Eviction> clear(AtlasClass atlasClass) {
        writeLock.lock();
        try {
            Map<TaskKey, List<Atlas>> next = new LinkedHashMap<>(snapshot);
            List<Eviction> evicted = new ArrayList<>();
            for (TaskKey key : keysOf(next, atlasClass)) {
                evicted.add(new Eviction(key, next.remove(key).size()));
            }
            publish(next);
            return evicted;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops non-persistent keys until their atlases fit {@code ceilingBytes}.
     * Older visible levels go first, then the active level, then the newest visible level
     * and finally the focused atlas.
     */
    public List<Eviction> trimStreamedTo(long ceilingBytes) {
        writeLock.lock();
        try {
            Map<TaskKey, List<Atlas>> next = new LinkedHashMap<>(snapshot);
            List<TaskKey> visible = keysOf(next, AtlasClass.VISIBLE);
            List<TaskKey> candidates = new ArrayList<>();
            if (!visible.isEmpty()) {
                candidates.addAll(visible.subList(0, visible.size() - 1));
            }
            candidates.addAll(keysOf(next, AtlasClass.ACTIVE));
            if (!visible.isEmpty()) {
                candidates.add(visible.get(visible.size() - 1));
            }
            candidates.addAll(keysOf(next, AtlasClass.FOCUSED));

            List<Eviction> evicted = new ArrayList<>();
            long used = streamedBytes(next);
            for (TaskKey key : candidates) {
                if (used <= ceilingBytes) {
                    break;
                }
                List<Atlas> removed = next.remove(key);
                used -= bytes(removed);
                evicted.add(new Eviction(key, removed.size()));
            }
            publish(next);
            if (!evicted.isEmpty()) {
                log.info("Trimmed atlas cache to {}: evicted {}", MemoryEstimate.formatBytes(ceilingBytes), evicted);
            }
            return evicted;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Finds a drawable region for {@code id}. Classes are searched focused, active, visible
     * (highest level first) and persistent; invalidated atlases are skipped.
     */
    public Optional<RegionLookup> findRegion(String id) {
        Map<TaskKey, List<Atlas>> current = snapshot;
        for (AtlasClass atlasClass : LOOKUP_ORDER) {
            List<TaskKey> keys = keysOf(current, atlasClass);
            keys.sort(Comparator.comparing(TaskKey::level).reversed());
            for (TaskKey key : keys) {
                for (Atlas atlas : current.get(key)) {
                    if (atlas.isInvalidated()) {
                        continue;
                    }
                    Optional<AtlasRegion> region = atlas.region(id);
                    if (region.isPresent()) {
                        return Optional.of(new RegionLookup(atlas, region.get()));
                    }
                }
            }
        }
        return Optional.empty();
    }

    public List<Atlas> atlases(TaskKey key) {
        return snapshot.getOrDefault(key, List.of());
    }

    public boolean contains(TaskKey key) {
        return snapshot.containsKey(key);
    }

    public boolean hasClass(AtlasClass atlasClass) {
        return snapshot.keySet().stream().anyMatch(key -> key.atlasClass() == atlasClass);
    }

    /**
     * @return true if an atlas of one of the given classes was invalidated.
     */
    public boolean hasInvalidated(AtlasClass... classes) {
        List<AtlasClass> wanted = List.of(classes);
        for (Map.Entry<TaskKey, List<Atlas>> entry : snapshot.entrySet()) {
            if (wanted.contains(entry.getKey().atlasClass())
                    && entry.getValue().stream().anyMatch(Atlas::isInvalidated)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Immutable view of the current contents, in install order.
     */
    public Map<TaskKey, List<Atlas>> snapshot() {
        return snapshot;
    }

    public long streamedBytes() {
        return streamedBytes(snapshot);
    }

    public long bytesOf(AtlasClass atlasClass) {
        long total = 0;
        for (Map.Entry<TaskKey, List<Atlas>> entry : snapshot.entrySet()) {
            if (entry.getKey().atlasClass() == atlasClass) {
                total += bytes(entry.getValue());
            }
        }
        return total;
    }

    @Override
    public List<MemoryEstimate> estimateMemory() {
        List<MemoryEstimate> estimates = new ArrayList<>();
        Map<TaskKey, List<Atlas>> current = snapshot;
        for (AtlasClass atlasClass : AtlasClass.values()) {
            List<TaskKey> keys = keysOf(current, atlasClass);
            if (keys.isEmpty()) {
                continue;
            }
            long total = 0;
            int count = 0;
            for (TaskKey key : keys) {
                total += bytes(current.get(key));
                count += current.get(key).size();
            }
            MemoryEstimate.Category category = atlasClass == AtlasClass.PERSISTENT
                ? MemoryEstimate.Category.PERSISTENT_ATLASES
                : MemoryEstimate.Category.STREAMED_ATLASES;
            estimates.add(new MemoryEstimate("atlas-cache/" + atlasClass, total,
                String.format("%d atlas(es) over %d level(s) = %s", count, keys.size(), MemoryEstimate.formatBytes(total)),
                category));
        }
        return estimates;
    }

    /**
     * Must be called while holding {@link #writeLock}.
     */
    private Optional<TaskKey> newerInstall(TaskKey key, long sequence) {
        boolean singleLevel = key.atlasClass() != AtlasClass.VISIBLE;
        for (TaskKey cached : snapshot.keySet()) {
            boolean sameSlot = cached.equals(key) || (singleLevel && cached.atlasClass() == key.atlasClass());
            Long installed = installedSequences.get(cached);
            if (sameSlot && installed != null && installed > sequence) {
                return Optional.of(cached);
            }
        }
        return Optional.empty();
    }

    private void publish(Map<TaskKey, List<Atlas>> next) {
        installedSequences.keySet().retainAll(next.keySet());
        snapshot = Collections.unmodifiableMap(next);
    }

    private static List<TaskKey> keysOf(Map<TaskKey, List<Atlas>> map, AtlasClass atlasClass) {
        List<TaskKey> keys = new ArrayList<>();
        for (TaskKey key : map.keySet()) {
            if (key.atlasClass() == atlasClass) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static long streamedBytes(Map<TaskKey, List<Atlas>> map) {
        long total = 0;
        for (Map.Entry<TaskKey, List<Atlas>> entry : map.entrySet()) {
            if (entry.getKey().atlasClass() != AtlasClass.PERSISTENT) {
                total += bytes(entry.getValue());
            }
        }
        return total;
    }

    private static long bytes(List<Atlas> atlases) {
        long total = 0;
        for (Atlas atlas : atlases) {
            total += atlas.memoryBytes();
        }
        return total;
    }
}
