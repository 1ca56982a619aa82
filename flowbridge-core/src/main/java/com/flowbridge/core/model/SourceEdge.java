package com.flowbridge.core.model;

import java.util.Objects;

/**
 * A transition between two source nodes.
 *
 * @param fromNodeId id of the node the transition leaves
 * @param toNodeId id of the node the transition enters
 * @param condition optional guard, null for unconditional transitions
 */
public record SourceEdge(
    String fromNodeId,
    String toNodeId,
    EdgeCondition condition
) {
    /**
     * Compact constructor with validation.
     */
    public SourceEdge {
        Objects.requireNonNull(fromNodeId, "fromNodeId must not be null");
        Objects.requireNonNull(toNodeId, "toNodeId must not be null");
    }

    /**
     * Returns the condition text, or an empty string when the edge has none.
     *
     * @return condition description
     */
    public String conditionText() {
        return condition != null ? condition.description() : "";
    }

    @Override
    public String toString() {
        return fromNodeId + " -> " + toNodeId;
    }
}
