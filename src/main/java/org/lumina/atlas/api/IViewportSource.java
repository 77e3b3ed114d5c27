package org.lumina.atlas.api;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the current viewport, polled by the coordinator on refresh.
 */
public interface IViewportSource {

    double currentZoom();

    Set<String> visibleIdentifiers();

    Optional<String> focusedIdentifier();

    /**
     * Identifiers of the cell under active interaction. Empty when there is none.
     */
    default Set<String> activeIdentifiers() {
        return Set.of();
    }
}
