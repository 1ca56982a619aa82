package com.flowbridge.core.analysis;

import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.CompilationWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Result of a branch-point analysis.
 *
 * @param depths first-visit BFS depth of every reachable node, in visit order
 * @param branchPoints reachable branch points, in source node order
 * @param maxRoutingDepth depth threshold used for classification
 * @param warnings one warning per deep branch point
 */
public record BranchAnalysis(
    Map<String, Integer> depths,
    List<BranchPoint> branchPoints,
    int maxRoutingDepth,
    List<CompilationWarning> warnings
) {
    public BranchAnalysis {
        Objects.requireNonNull(depths, "depths must not be null");
        depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
        branchPoints = branchPoints == null ? List.of() : List.copyOf(branchPoints);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<BranchPoint> nearBranchPoints() {
        return branchPoints.stream().filter(BranchPoint::isNear).toList();
    }

    public List<BranchPoint> deepBranchPoints() {
        return branchPoints.stream().filter(b -> !b.isNear()).toList();
    }

    public boolean isReachable(String nodeId) {
        return depths.containsKey(nodeId);
    }

    public OptionalInt depth(String nodeId) {
        Integer depth = depths.get(nodeId);
        return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
    }
}
