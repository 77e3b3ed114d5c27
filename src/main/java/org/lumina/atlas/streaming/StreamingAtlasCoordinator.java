package org.lumina.atlas.streaming;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.lumina.atlas.api.IPhotoLoader;
import org.lumina.atlas.api.IViewportSource;
import org.lumina.atlas.assembly.AtlasAssembler;
import org.lumina.atlas.budget.DeviceCapabilities;
import org.lumina.atlas.budget.IMemoryEstimatable;
import org.lumina.atlas.budget.MemoryBudget;
import org.lumina.atlas.budget.MemoryBudgetCalculator;
import org.lumina.atlas.budget.MemoryEstimate;
import org.lumina.atlas.budget.PressureLevel;
import org.lumina.atlas.config.AtlasSettings;
import org.lumina.atlas.distribution.DistributionStrategist;
import org.lumina.atlas.lod.LodPolicy;
import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.DetailLevel;
import org.lumina.atlas.model.GenerationRequest;
import org.lumina.atlas.model.SourceImage;
import org.lumina.atlas.packing.ShelfPacker;
import org.lumina.atlas.regeneration.RegenerationDecider;
import org.lumina.atlas.regeneration.RegenerationDecision;
import org.lumina.atlas.regeneration.RegenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams atlases for a changing viewport.
 * <p>
 * <strong>Lifecycle:</strong> {@link #start(Collection)} moves the coordinator from
 * {@link State#STOPPED} to {@link State#RUNNING} and builds the persistent lowest-level
 * atlas set for the whole catalog. {@link #close()} cancels in-flight work and stops the
 * executors; if they do not terminate in time the coordinator ends in {@link State#ERROR}.
 * <p>
 * <strong>Submissions:</strong> every {@link #submit} gets the next sequence number and a
 * {@link RegenerationDecision}. FULL schedules the visible level, the boosted active level
 * (if there are active ids) and the focused photo at the maximum level (if there is one).
 * SELECTIVE schedules only the focused photo, or drops the focused atlas when focus was
 * cleared. Each scheduled task is keyed by level and class; a newer submission cancels an
 * older in-flight task with the same key, while tasks with other keys run to completion and
 * are still reported. The active and focused classes hold a single level, so there a newer
 * submission cancels older tasks of the class at any level.
 * <p>
 * A streamed level that was trimmed under memory pressure or failed to regenerate makes the
 * next submission a full one; a failed persistent build is retried by the next catalog
 * update.
 * <p>
 * <strong>Threads:</strong> level tasks run on a cached executor, plan entries on a bounded
 * worker pool sized by {@link MemoryBudget#parallelism()}. Events are delivered on those
 * threads.
 */
public class StreamingAtlasCoordinator implements AutoCloseable, IMemoryEstimatable {

    private static final Logger log = LoggerFactory.getLogger(StreamingAtlasCoordinator.class);

    /**
     * Lifecycle state.
     */
    public enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    /**
     * Handle returned by {@link #subscribe}. Closing it removes the listener.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private final IPhotoLoader loader;
    private final IViewportSource viewport;
    private final AtlasSettings settings;
    private final DeviceCapabilities capabilities;
    private final MemoryBudgetCalculator budgetCalculator;
    private final DistributionStrategist strategist;
    private final ShelfPacker packer;
    private final AtlasAssembler assembler;
    private final LodPolicy lodPolicy = new LodPolicy();
    private final RegenerationDecider decider = new RegenerationDecider();
    private final AtlasCache cache;
    private final FailedPhotoRegistry failedPhotos;

    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicLong sequenceCounter = new AtomicLong();
    private final List<IAtlasEventListener> listeners = new CopyOnWriteArrayList<>();

    /** Guards everything below. */
    private final Object lock = new Object();
    private final Map<TaskKey, LevelGenerationTask> activeTasks = new HashMap<>();
    private Map<String, SourceImage> catalog = Map.of();
    private GenerationRequest lastRequest;
    /** Set when a streamed atlas was invalidated, trimmed or failed to regenerate. */
    private boolean streamedInvalidated;
    private boolean persistentFailed;
    private PressureLevel pressure = PressureLevel.NORMAL;
    private volatile MemoryBudget budget;
    private ExecutorService taskExecutor;
    private ThreadPoolExecutor workerPool;
    private GenerationContext context;

    public StreamingAtlasCoordinator(IPhotoLoader loader, AtlasSettings settings) {
        this(loader, null, settings);
    }

    /**
     * @param loader   Photo decoder.
     * @param viewport Viewport polled by {@link #refresh()}, or {@code null}.
     * @param settings Pipeline configuration.
     */
    public StreamingAtlasCoordinator(IPhotoLoader loader, IViewportSource viewport, AtlasSettings settings) {
        this(loader, viewport, settings, settings.capabilities(),
            new MemoryBudgetCalculator(settings.tierProfiles()),
            new DistributionStrategist(new ShelfPacker(), settings.distribution()),
            new AtlasAssembler());
    }

    StreamingAtlasCoordinator(IPhotoLoader loader, IViewportSource viewport, AtlasSettings settings,
                              DeviceCapabilities capabilities, MemoryBudgetCalculator budgetCalculator,
                              DistributionStrategist strategist, AtlasAssembler assembler) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.viewport = viewport;
        this.settings = settings;
        this.capabilities = capabilities;
        this.budgetCalculator = budgetCalculator;
        this.strategist = strategist;
        this.packer = new ShelfPacker();
        this.assembler = assembler;
        this.cache = new AtlasCache(settings.visibleWindow());
        this.failedPhotos = new FailedPhotoRegistry(settings.failedPhotoTtl(), settings.failedPhotoMaxSize());
        this.budget = effectiveBudget(budgetCalculator.computeBudget(capabilities, PressureLevel.NORMAL));
    }

    /**
     * Starts the executors and builds the persistent atlas set for {@code initialCatalog}.
     *
     * @return Completes when the persistent set has been generated (or failed).
     * @throws IllegalStateException if the coordinator is not stopped.
     */
    public CompletableFuture<Void> start(Collection<SourceImage> initialCatalog) {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format(
                "Cannot start atlas coordinator as it is already in state %s", getCurrentState()));
        }
        synchronized (lock) {
            MemoryBudget current = budget;
            taskExecutor = Executors.newCachedThreadPool(namedThreads("atlas-level"));
            workerPool = new ThreadPoolExecutor(current.parallelism(), current.parallelism(),
                30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), namedThreads("atlas-worker"));
            context = new GenerationContext(loader, strategist, packer, assembler, cache, failedPhotos,
                workerPool, this::emit, settings.decodeTimeout(), settings.decodeRetries());
            catalog = index(initialCatalog);
            log.info("Atlas coordinator started: {} photo(s), tier {}, {}", catalog.size(),
                capabilities.tier(), current);
            return rebuildPersistent();
        }
    }

    /**
     * Replaces the catalog. The persistent set is rebuilt only if the id set changed or one
     * of its atlases was invalidated.
     */
    public CompletableFuture<Void> updateCatalog(Collection<SourceImage> newCatalog) {
        requireRunning();
        synchronized (lock) {
            Map<String, SourceImage> indexed = index(newCatalog);
            boolean changed = !indexed.keySet().equals(catalog.keySet());
            catalog = indexed;
            if (!changed && !persistentFailed && !cache.hasInvalidated(AtlasClass.PERSISTENT)) {
                log.debug("Catalog unchanged ({} photos), keeping persistent atlases", indexed.size());
                return CompletableFuture.completedFuture(null);
            }
            return rebuildPersistent();
        }
    }

    /**
     * Submits a new viewport state.
     *
     * @param visibleIds Ids currently visible.
     * @param zoom       Current zoom factor.
     * @param focusedId  Focused id, or {@code null}.
     * @param activeIds  Ids of the active cell, may be empty.
     */
    public GenerationHandle submit(Set<String> visibleIds, double zoom, String focusedId, Set<String> activeIds) {
        requireRunning();
        synchronized (lock) {
            GenerationRequest request = new GenerationRequest(sequenceCounter.incrementAndGet(),
                visibleIds, zoom, focusedId, activeIds);
            GenerationRequest previous = lastRequest;
            RegenerationDecision decision = decider.decide(stateFor(previous, request));
            lastRequest = request;
            streamedInvalidated = false;

            log.debug("Submission {} (zoom {}, {} visible, focus {}): {}", request.sequence(), zoom,
                request.visibleIds().size(), focusedId, decision);

            List<CompletableFuture<LevelGenerationTask.Result>> scheduled = new ArrayList<>();
            switch (decision) {
                case NONE -> {
                    return new GenerationHandle(request.sequence(), decision, CompletableFuture.completedFuture(null));
                }
                case FULL -> scheduleFull(request, previous, scheduled);
                case SELECTIVE -> scheduleFocused(request, scheduled);
                default -> throw new IllegalStateException("Unknown decision " + decision);
            }
            return new GenerationHandle(request.sequence(), decision, completeAll(request.sequence(), scheduled));
        }
    }

    /**
     * Submits the state of the configured {@link IViewportSource}.
     *
     * @throws IllegalStateException if no viewport source was configured.
     */
    public GenerationHandle refresh() {
        if (viewport == null) {
            throw new IllegalStateException("No viewport source configured");
        }
        return submit(viewport.visibleIdentifiers(), viewport.currentZoom(),
            viewport.focusedIdentifier().orElse(null), viewport.activeIdentifiers());
    }

    /**
     * Applies a new memory pressure level: recomputes the budget, resizes the worker pool
     * and trims streamed atlases to the new ceiling. The persistent set is kept.
     */
    public void onMemoryPressure(PressureLevel level) {
        List<AtlasCache.Eviction> evicted;
        synchronized (lock) {
            pressure = level;
            MemoryBudget next = effectiveBudget(budgetCalculator.computeBudget(capabilities, level));
            budget = next;
            if (workerPool != null) {
                resizePool(workerPool, next.parallelism());
            }
            evicted = cache.trimStreamedTo(next.byteCeiling());
            if (!evicted.isEmpty()) {
                streamedInvalidated = true;
            }
            log.info("Memory pressure {}: {}", level, next);
        }
        long sequence = sequenceCounter.get();
        for (AtlasCache.Eviction eviction : evicted) {
            emit(new AtlasEvent.AtlasRemoved(sequence, eviction.key().level(), eviction.key().atlasClass(),
                eviction.count()));
        }
    }

    /**
     * Applies the pressure level derived from a heap usage fraction.
     */
    public void onMemoryUsage(double usageFraction) {
        onMemoryPressure(settings.pressureFor(usageFraction));
    }

    /**
     * Marks an atlas as reclaimed outside the pipeline. It is no longer returned by lookups,
     * and the next submission (or catalog update, for persistent atlases) regenerates it.
     */
    public void invalidate(Atlas atlas) {
        if (atlas.invalidate()) {
            log.info("Atlas invalidated: {}", atlas);
            if (atlas.atlasClass() != AtlasClass.PERSISTENT) {
                synchronized (lock) {
                    streamedInvalidated = true;
                }
            }
        }
    }

    /**
     * Looks up where {@code id} can be drawn from. Prefers focused, then active, then visible
     * (highest level first), then persistent atlases.
     */
    public Optional<RegionLookup> findRegion(String id) {
        return cache.findRegion(id);
    }

    public Subscription subscribe(IAtlasEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    public State getCurrentState() {
        return currentState.get();
    }

    public MemoryBudget currentBudget() {
        return budget;
    }

    public PressureLevel currentPressure() {
        synchronized (lock) {
            return pressure;
        }
    }

    AtlasCache cache() {
        return cache;
    }

    FailedPhotoRegistry failedPhotos() {
        return failedPhotos;
    }

    @Override
    public List<MemoryEstimate> estimateMemory() {
        List<MemoryEstimate> estimates = new ArrayList<>(cache.estimateMemory());
        MemoryBudget current = budget;
        long inFlight = (long) current.parallelism() * MemoryBudget.bytesFor(current.largestSize());
        estimates.add(new MemoryEstimate("atlas-workers", inFlight,
            String.format("%d worker(s) × %d² × 4B", current.parallelism(), current.largestSize()),
            MemoryEstimate.Category.IN_FLIGHT));
        return estimates;
    }

    /**
     * Cancels in-flight work and stops the executors. Does nothing if already stopped.
     */
    @Override
    public void close() {
        if (!currentState.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }
        List<ExecutorService> executors;
        synchronized (lock) {
            for (LevelGenerationTask task : activeTasks.values()) {
                cache.revoke(task.token());
            }
            activeTasks.clear();
            executors = List.of(taskExecutor, workerPool);
        }
        long timeoutMs = settings.shutdownTimeout().toMillis();
        for (ExecutorService executor : executors) {
            executor.shutdownNow();
        }
        try {
            for (ExecutorService executor : executors) {
                if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.error("Atlas executor did not stop within {} ms! Forcing ERROR state.", timeoutMs);
                    currentState.set(State.ERROR);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for atlas executors to stop");
        }
        log.info("Atlas coordinator stopped");
    }

    private RegenerationState stateFor(GenerationRequest previous, GenerationRequest request) {
        boolean atlasExists = cache.hasClass(AtlasClass.VISIBLE)
            || activeTasks.keySet().stream().anyMatch(key -> key.atlasClass() == AtlasClass.VISIBLE);
        if (previous == null) {
            return new RegenerationState(atlasExists, true, true, false, request.focusedId() != null);
        }
        boolean visibleChanged = !previous.visibleIds().equals(request.visibleIds())
            || !previous.activeIds().equals(request.activeIds());
        boolean boundaryCrossed = lodPolicy.crossedBoundary(previous.zoom(), request.zoom()).isPresent();
        boolean invalidated = streamedInvalidated
            || cache.hasInvalidated(AtlasClass.VISIBLE, AtlasClass.ACTIVE, AtlasClass.FOCUSED);
        boolean focusChanged = !Objects.equals(previous.focusedId(), request.focusedId());
        return new RegenerationState(atlasExists, visibleChanged, boundaryCrossed, invalidated, focusChanged);
    }

    private void scheduleFull(GenerationRequest request, GenerationRequest previous,
                              List<CompletableFuture<LevelGenerationTask.Result>> scheduled) {
        DetailLevel level = lodPolicy.levelFor(request.zoom());
        scheduled.add(schedule(request.sequence(), new TaskKey(level, AtlasClass.VISIBLE),
            request.visibleIds(), null));

        if (!request.activeIds().isEmpty()) {
            scheduled.add(schedule(request.sequence(), new TaskKey(lodPolicy.boostedLevel(request.zoom()),
                AtlasClass.ACTIVE), request.activeIds(), null));
        } else if (previous != null && !previous.activeIds().isEmpty()) {
            clearClass(request.sequence(), AtlasClass.ACTIVE);
        }

        scheduleFocused(request, scheduled);
    }

    private void scheduleFocused(GenerationRequest request,
                                 List<CompletableFuture<LevelGenerationTask.Result>> scheduled) {
        if (request.focusedId() != null) {
            scheduled.add(schedule(request.sequence(), new TaskKey(lodPolicy.levelForFocused(), AtlasClass.FOCUSED),
                Set.of(request.focusedId()), request.focusedId()));
        } else {
            clearClass(request.sequence(), AtlasClass.FOCUSED);
        }
    }

    private void clearClass(long sequence, AtlasClass atlasClass) {
        for (TaskKey key : List.copyOf(activeTasks.keySet())) {
            if (key.atlasClass() == atlasClass) {
                cache.revoke(activeTasks.remove(key).token());
            }
        }
        for (AtlasCache.Eviction eviction : cache.clear(atlasClass)) {
            emit(new AtlasEvent.AtlasRemoved(sequence, eviction.key().level(), atlasClass, eviction.count()));
        }
    }

    private CompletableFuture<Void> rebuildPersistent() {
        persistentFailed = false;
        long sequence = sequenceCounter.incrementAndGet();
        CompletableFuture<LevelGenerationTask.Result> future = schedule(sequence,
            new TaskKey(DetailLevel.min(), AtlasClass.PERSISTENT), catalog.keySet(), null);
        return completeAll(sequence, List.of(future));
    }

    /**
     * Must be called while holding {@link #lock}.
     */
    private CompletableFuture<LevelGenerationTask.Result> schedule(long sequence, TaskKey key, Set<String> ids,
                                                                   String focusedId) {
        boolean singleLevel = key.atlasClass() != AtlasClass.VISIBLE;
        for (LevelGenerationTask existing : List.copyOf(activeTasks.values())) {
            TaskKey existingKey = existing.key();
            boolean sameSlot = existingKey.equals(key) || (singleLevel && existingKey.atlasClass() == key.atlasClass());
            if (sameSlot && existing.sequence() < sequence && cache.revoke(existing.token())) {
                activeTasks.remove(existingKey, existing);
                log.debug("Cancelled {} (seq {}) in favour of {} (seq {})", existingKey, existing.sequence(),
                    key, sequence);
            }
        }

        List<SourceImage> images = new ArrayList<>(ids.size());
        List<String> unknown = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            SourceImage image = catalog.get(id);
            if (image != null) {
                images.add(image);
            } else {
                unknown.add(id);
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("{} id(s) are not in the catalog and will be reported as failed: {}", unknown.size(), unknown);
        }

        CancellationToken token = new CancellationToken();
        LevelGenerationTask task = new LevelGenerationTask(context, sequence, key, images, unknown, focusedId,
            budget, token);
        activeTasks.put(key, task);
        return CompletableFuture.supplyAsync(task::run, taskExecutor)
            .whenComplete((result, error) -> {
                synchronized (lock) {
                    activeTasks.remove(key, task);
                    if (result != null && result.outcome() == LevelGenerationTask.Outcome.FAILED) {
                        if (key.atlasClass() == AtlasClass.PERSISTENT) {
                            persistentFailed = true;
                        } else {
                            streamedInvalidated = true;
                        }
                    }
                }
            });
    }

    private CompletableFuture<Void> completeAll(long sequence, List<CompletableFuture<LevelGenerationTask.Result>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        return all.handle((ignored, error) -> {
            if (error != null) {
                log.error("Submission {} ended abnormally", sequence, error);
            }
            int total = 0;
            for (CompletableFuture<LevelGenerationTask.Result> future : futures) {
                LevelGenerationTask.Result result = future.getNow(null);
                if (result != null && result.outcome() == LevelGenerationTask.Outcome.READY) {
                    total += result.atlasCount();
                }
            }
            emit(new AtlasEvent.AllComplete(sequence, total));
            if (log.isDebugEnabled()) {
                log.debug("Submission {} complete: {} atlas(es), pipeline holds {}", sequence, total,
                    MemoryEstimate.formatBytes(totalEstimatedBytes()));
            }
            return null;
        });
    }

    private MemoryBudget effectiveBudget(MemoryBudget computed) {
        if (!computed.isExhausted()) {
            return computed;
        }
        MemoryBudget degraded = MemoryBudget.degraded(settings.degradedAtlasSize());
        log.warn("Memory budget exhausted ({}), degrading to sequential generation with {}", computed, degraded);
        return degraded;
    }

    private void emit(AtlasEvent event) {
        for (IAtlasEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Atlas event listener {} failed on {}", listener, event.getClass().getSimpleName(), e);
            }
        }
    }

    private void requireRunning() {
        State state = getCurrentState();
        if (state != State.RUNNING) {
            throw new IllegalStateException("Atlas coordinator is not running (state " + state + ")");
        }
    }

    private static void resizePool(ThreadPoolExecutor pool, int parallelism) {
        if (parallelism > pool.getMaximumPoolSize()) {
            pool.setMaximumPoolSize(parallelism);
            pool.setCorePoolSize(parallelism);
        } else {
            pool.setCorePoolSize(parallelism);
            pool.setMaximumPoolSize(parallelism);
        }
    }

    private static Map<String, SourceImage> index(Collection<SourceImage> images) {
        Map<String, SourceImage> indexed = new LinkedHashMap<>();
        for (SourceImage image : images) {
            indexed.put(image.id(), image);
        }
        return indexed;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
