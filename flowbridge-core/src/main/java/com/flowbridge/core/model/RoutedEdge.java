package com.flowbridge.core.model;

import java.util.Objects;

/**
 * Records which gate output port carries a branch point's transition to its successor.
 *
 * @param edge original source transition
 * @param gateInstanceId gate whose output reaches the successor
 * @param outputPort name of the gate output port wired to the successor
 */
public record RoutedEdge(
    SourceEdge edge,
    String gateInstanceId,
    String outputPort
) {
    /**
     * Compact constructor with validation.
     */
    public RoutedEdge {
        Objects.requireNonNull(edge, "edge must not be null");
        Objects.requireNonNull(gateInstanceId, "gateInstanceId must not be null");
        Objects.requireNonNull(outputPort, "outputPort must not be null");
    }
}
