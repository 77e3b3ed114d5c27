package org.lumina.atlas.model;

import java.util.Optional;
import java.util.Set;

/**
 * One submitted viewport state.
 * <p>
 * The sequence number is assigned by the coordinator at submission time and is the only
 * authority for "latest wins" ordering.
 *
 * @param sequence   Monotonic submission sequence.
 * @param visibleIds Identifiers currently visible.
 * @param zoom       Current zoom factor.
 * @param focusedId  The focused identifier, or {@code null}.
 * @param activeIds  Identifiers of the active cell (may be empty).
 */
public record GenerationRequest(long sequence, Set<String> visibleIds, double zoom,
                                String focusedId, Set<String> activeIds) {

    public GenerationRequest {
        if (Double.isNaN(zoom)) {
            throw new IllegalArgumentException("Zoom must be a number");
        }
        visibleIds = Set.copyOf(visibleIds);
        activeIds = activeIds == null ? Set.of() : Set.copyOf(activeIds);
    }

    public Optional<String> focused() {
        return Optional.ofNullable(focusedId);
    }
}
