package com.flowbridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Classifier and gate chain selecting exactly one successor of a branch point.
 *
 * <p>For N successors the plan holds one classifier and N - 1 gates; gate k matches
 * digit k and the last gate's no-match output is the default path for successor N.
 *
 * @param branchPointNodeId source node the plan routes
 * @param classifierInstanceId classifier instance
 * @param gateInstanceIds gates in chain order
 * @param routedEdges one entry per original outgoing transition, in edge order
 */
public record RoutingPlan(
    String branchPointNodeId,
    String classifierInstanceId,
    List<String> gateInstanceIds,
    List<RoutedEdge> routedEdges
) {
    /**
     * Compact constructor with validation.
     */
    public RoutingPlan {
        Objects.requireNonNull(branchPointNodeId, "branchPointNodeId must not be null");
        Objects.requireNonNull(classifierInstanceId, "classifierInstanceId must not be null");
        gateInstanceIds = gateInstanceIds == null ? List.of() : List.copyOf(gateInstanceIds);
        routedEdges = routedEdges == null ? List.of() : List.copyOf(routedEdges);
        if (routedEdges.size() < 2 || gateInstanceIds.size() != routedEdges.size() - 1) {
            throw new IllegalArgumentException("Routing plan for " + branchPointNodeId + " has "
                + gateInstanceIds.size() + " gates for " + routedEdges.size() + " successors");
        }
    }

    /**
     * Returns the successor node ids in routing order.
     *
     * @return successor ids
     */
    public List<String> successorIds() {
        return routedEdges.stream().map(r -> r.edge().toNodeId()).toList();
    }

    /**
     * Returns the number of routed successors.
     *
     * @return successor count
     */
    public int branchCount() {
        return routedEdges.size();
    }
}
