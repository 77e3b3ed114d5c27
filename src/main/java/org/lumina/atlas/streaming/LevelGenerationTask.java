package org.lumina.atlas.streaming;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.lumina.atlas.api.PhotoDecodeException;
import org.lumina.atlas.api.PhotoLoaderUnavailableException;
import org.lumina.atlas.assembly.AssemblyResult;
import org.lumina.atlas.budget.MemoryBudget;
import org.lumina.atlas.distribution.AtlasPlanEntry;
import org.lumina.atlas.distribution.DistributionPlan;
import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.DecodedRaster;
import org.lumina.atlas.model.PlanImage;
import org.lumina.atlas.model.SourceImage;
import org.lumina.atlas.packing.PackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the atlases of one {@link TaskKey} for one submission.
 * <p>
 * Steps: emit {@code Loading}; size the images for the level; plan with the distribution
 * strategist; decode, pack and assemble every plan entry on the worker pool (emitting
 * {@code Progress} as entries finish); install the result into the cache; emit
 * {@code LevelReady}. The decodes of one entry are all requested up front and each is
 * awaited until its own deadline.
 * <p>
 * <strong>Cancellation</strong> is checked before and after each decode, before packing
 * and at install time. A cancelled task emits nothing after {@code Loading} and leaves the
 * cache untouched. Decoded rasters are always released, also on cancellation.
 * <p>
 * <strong>Failures:</strong> a single photo failure is reported in
 * {@code LevelReady.failedIds}. A retryable decode failure is attempted again up to the
 * configured retry count; a timeout is not retried. A loader that is unavailable, or any
 * unexpected exception, fails the whole task with {@code LevelFailed} and cancels the
 * task's remaining work. So does a plan whose photos all failed; the atlases cached for the
 * key are kept in both cases.
 */
class LevelGenerationTask {

    private static final Logger log = LoggerFactory.getLogger(LevelGenerationTask.class);

    enum Outcome {
        READY,
        FAILED,
        CANCELLED
    }

    /**
     * @param atlasCount Atlases installed (0 unless {@link Outcome#READY}).
     */
    record Result(TaskKey key, Outcome outcome, int atlasCount) {
    }

    private final GenerationContext context;
    private final long sequence;
    private final TaskKey key;
    private final List<SourceImage> images;
    private final List<String> unknownIds;
    private final String focusedId;
    private final MemoryBudget budget;
    private final CancellationToken token;

    LevelGenerationTask(GenerationContext context, long sequence, TaskKey key, List<SourceImage> images,
                        List<String> unknownIds, String focusedId, MemoryBudget budget, CancellationToken token) {
        this.context = context;
        this.sequence = sequence;
        this.key = key;
        this.images = List.copyOf(images);
        this.unknownIds = List.copyOf(unknownIds);
        this.focusedId = focusedId;
        this.budget = budget;
        this.token = token;
    }

    TaskKey key() {
        return key;
    }

    long sequence() {
        return sequence;
    }

    CancellationToken token() {
        return token;
    }

    Result run() {
        try {
            token.throwIfCancelled();
            context.events().accept(new AtlasEvent.Loading(sequence, key.level(), key.atlasClass()));
            return generate();
        } catch (CancellationException e) {
            log.debug("Task {} (seq {}) cancelled", key, sequence);
            return new Result(key, Outcome.CANCELLED, 0);
        } catch (PhotoLoaderUnavailableException e) {
            token.cancel();
            return fail("photo loader unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            token.cancel();
            return fail(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private Result generate() {
        List<String> failedIds = new ArrayList<>(unknownIds);
        List<PlanImage> planImages = new ArrayList<>(images.size());
        for (SourceImage image : images) {
            if (context.failedPhotos().isFailed(image.id())) {
                failedIds.add(image.id());
            } else {
                planImages.add(PlanImage.at(image, key.level()));
            }
        }

        DistributionPlan plan = context.strategist().plan(planImages, key.level(), focusedId, budget);
        failedIds.addAll(plan.permanentlyFailedIds());
        List<AtlasPlanEntry> entries = plan.entries();

        List<Future<AssemblyResult>> futures = new ArrayList<>(entries.size());
        for (AtlasPlanEntry entry : entries) {
            token.throwIfCancelled();
            Future<AssemblyResult> future = context.workers().submit(() -> buildEntry(entry));
            token.register(future);
            futures.add(future);
        }

        List<Atlas> atlases = new ArrayList<>(entries.size());
        int done = 0;
        for (Future<AssemblyResult> future : futures) {
            AssemblyResult result = await(future);
            done++;
            failedIds.addAll(result.failed());
            if (result.atlas().regions().isEmpty()) {
                log.debug("Dropping empty atlas for {} (seq {})", key, sequence);
            } else {
                atlases.add(result.atlas());
            }
            token.throwIfCancelled();
            context.events().accept(new AtlasEvent.Progress(sequence, key.level(), key.atlasClass(),
                (double) done / futures.size()));
        }

        if (atlases.isEmpty() && !entries.isEmpty()) {
            // Nothing drawable: the previous atlases of this key stay in place.
            return fail(String.format("no photo could be decoded (%d failed)", failedIds.size()), null);
        }

        AtlasCache.InstallResult installed = context.cache().install(key, sequence, atlases, token);
        if (!installed.installed()) {
            throw new CancellationException("Superseded before install");
        }
        for (AtlasCache.Eviction eviction : installed.evicted()) {
            context.events().accept(new AtlasEvent.AtlasRemoved(sequence, eviction.key().level(),
                eviction.key().atlasClass(), eviction.count()));
        }

        if (failedIds.isEmpty()) {
            log.debug("{} ready (seq {}): {} atlas(es)", key, sequence, atlases.size());
        } else {
            log.warn("{} ready (seq {}) with {} atlas(es), {} photo(s) failed", key, sequence, atlases.size(),
                failedIds.size());
        }
        context.events().accept(new AtlasEvent.LevelReady(sequence, key.level(), key.atlasClass(), atlases, failedIds));
        return new Result(key, Outcome.READY, atlases.size());
    }

    private AssemblyResult await(Future<AssemblyResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for atlas assembly");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Atlas assembly failed", cause);
        } finally {
            token.unregister(future);
        }
    }

    /**
     * A decode in flight and the point in time after which it counts as timed out.
     */
    private record PendingDecode(PlanImage image, CompletableFuture<DecodedRaster> future, long deadlineNanos) {
    }

    /**
     * Runs on a worker thread: request all member decodes at once, collect them, pack, assemble.
     */
    private AssemblyResult buildEntry(AtlasPlanEntry entry) {
        List<PendingDecode> pending = new ArrayList<>(entry.members().size());
        List<DecodedRaster> rasters = new ArrayList<>(entry.members().size());
        int collected = 0;
        boolean handedOver = false;
        try {
            for (PlanImage member : entry.members()) {
                token.throwIfCancelled();
                pending.add(startDecode(member));
            }
            for (PendingDecode decode : pending) {
                DecodedRaster raster = awaitDecode(decode);
                collected++;
                if (raster != null) {
                    rasters.add(raster);
                }
                token.throwIfCancelled();
            }

            PackResult packed = context.packer().pack(entry.members(), entry.size(),
                context.strategist().options().padding());
            token.throwIfCancelled();

            handedOver = true;
            AssemblyResult result = context.assembler().assemble(rasters, packed.placed(), entry.size(),
                entry.detailLevel(), key.atlasClass(), sequence);
            if (packed.allPlaced()) {
                return result;
            }
            List<String> failed = new ArrayList<>(result.failed());
            packed.rejected().forEach(image -> failed.add(image.id()));
            return new AssemblyResult(result.atlas(), failed);
        } finally {
            if (!handedOver) {
                rasters.forEach(DecodedRaster::release);
                for (int i = collected; i < pending.size(); i++) {
                    discard(pending.get(i).future());
                }
            }
        }
    }

    private PendingDecode startDecode(PlanImage image) {
        CompletableFuture<DecodedRaster> future;
        try {
            future = context.loader().decode(image.id(), image.width(), image.height());
        } catch (PhotoDecodeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        token.register(future);
        return new PendingDecode(image, future, System.nanoTime() + context.decodeTimeout().toNanos());
    }

    /**
     * Waits for one decode until its deadline, requesting it again for retryable failures.
     *
     * @return The raster, or {@code null} if the photo failed.
     * @throws PhotoLoaderUnavailableException if the loader cannot serve any request.
     * @throws CancellationException           if the task was cancelled meanwhile.
     */
    private DecodedRaster awaitDecode(PendingDecode decode) {
        PlanImage image = decode.image();
        int attempts = 1 + context.decodeRetries();
        PendingDecode current = decode;
        for (int attempt = 1; ; attempt++) {
            try {
                long remaining = Math.max(0, current.deadlineNanos() - System.nanoTime());
                DecodedRaster raster = current.future().get(remaining, TimeUnit.NANOSECONDS);
                if (token.isCancelled()) {
                    if (raster != null) {
                        raster.release();
                    }
                    throw new CancellationException("Superseded during decode");
                }
                return raster;
            } catch (TimeoutException e) {
                current.future().cancel(true);
                log.warn("Decoding '{}' timed out after {}", image.id(), context.decodeTimeout());
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while decoding " + image.id());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PhotoLoaderUnavailableException unavailable) {
                    throw unavailable;
                }
                if (!(cause instanceof PhotoDecodeException failure)) {
                    log.warn("Decoding '{}' failed unexpectedly: {}", image.id(), String.valueOf(cause));
                    return null;
                }
                if (!failure.isRetryable() || attempt >= attempts) {
                    if (!failure.isRetryable()) {
                        context.failedPhotos().record(image.id(), failure.getMessage());
                    }
                    log.warn("Giving up on '{}': {}", image.id(), failure.getMessage());
                    return null;
                }
                log.debug("Retrying '{}' after: {}", image.id(), failure.getMessage());
            } finally {
                token.unregister(current.future());
            }
            current = startDecode(image);
        }
    }

    /**
     * Cancels a decode that will not be collected, releasing its raster if it already arrived.
     */
    private void discard(CompletableFuture<DecodedRaster> future) {
        token.unregister(future);
        if (future.cancel(true)) {
            return;
        }
        if (!future.isCompletedExceptionally()) {
            DecodedRaster raster = future.getNow(null);
            if (raster != null) {
                raster.release();
            }
        }
    }

    /**
     * @param e Cause to log, or {@code null}.
     */
    private Result fail(String reason, Exception e) {
        if (e != null) {
            log.error("Generation of {} (seq {}) failed: {}", key, sequence, reason, e);
        } else {
            log.error("Generation of {} (seq {}) failed: {}", key, sequence, reason);
        }
        context.events().accept(new AtlasEvent.LevelFailed(sequence, key.level(), key.atlasClass(), reason));
        return new Result(key, Outcome.FAILED, 0);
    }
}
