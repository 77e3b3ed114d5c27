package org.lumina.atlas.streaming;

import java.util.concurrent.CompletableFuture;

import org.lumina.atlas.regeneration.RegenerationDecision;

/**
 * Returned by {@link StreamingAtlasCoordinator#submit}.
 *
 * @param sequence   Sequence number assigned to the submission.
 * @param decision   What the submission required.
 * @param completion Completes once every task scheduled for the submission has finished,
 *                   failed or been cancelled. Already complete for {@link RegenerationDecision#NONE}.
 */
public record GenerationHandle(long sequence, RegenerationDecision decision, CompletableFuture<Void> completion) {
}
