package com.flowbridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A reachable source node with two or more outgoing transitions.
 *
 * @param nodeId branch point node id
 * @param depth breadth-first depth from the entry node (entry = 0)
 * @param proximity near/deep classification
 * @param outgoing outgoing transitions in document order
 */
public record BranchPoint(
    String nodeId,
    int depth,
    BranchProximity proximity,
    List<SourceEdge> outgoing
) {
    /**
     * Compact constructor with validation.
     */
    public BranchPoint {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(proximity, "proximity must not be null");
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
    }

    /**
     * Returns whether this branch point is routed by a classifier and gates.
     *
     * @return true for near branch points
     */
    public boolean isNear() {
        return proximity == BranchProximity.NEAR;
    }
}
