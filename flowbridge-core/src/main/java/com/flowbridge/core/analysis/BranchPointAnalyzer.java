package com.flowbridge.core.analysis;

import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.BranchProximity;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.SourceEdge;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;
import com.flowbridge.core.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds branch points and decides which of them get routing.
 *
 * <p>Depth is the first-visit layer of a breadth-first traversal from the entry node, so cycles
 * terminate and a node reachable along several paths keeps its shallowest depth. A reachable node
 * with two or more outgoing edges is a branch point; it is {@link BranchProximity#NEAR} when its
 * depth does not exceed the configured threshold and {@link BranchProximity#DEEP} otherwise.
 *
 * <p>Deep branch points keep plain fan-out wiring. The runtime propagates data along every wired
 * connection, so every successor of a deep branch point may run on the same turn; each one is
 * reported as an {@link WarningKind#UNROUTED_BRANCH} warning.
 */
public class BranchPointAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BranchPointAnalyzer.class);

    private final int maxRoutingDepth;

    /**
     * Creates an analyzer.
     *
     * @param maxRoutingDepth deepest layer that still gets routing (0 routes only the entry node)
     */
    public BranchPointAnalyzer(int maxRoutingDepth) {
        if (maxRoutingDepth < 0) {
            throw new IllegalArgumentException("maxRoutingDepth must not be negative: " + maxRoutingDepth);
        }
        this.maxRoutingDepth = maxRoutingDepth;
    }

    /**
     * Analyzes a source graph.
     *
     * @param graph parsed source graph
     * @return depths, branch points and deep-branch warnings
     */
    public BranchAnalysis analyze(SourceGraph graph) {
        Map<String, List<SourceEdge>> outgoing = graph.outgoingByNode();
        Map<String, Integer> depths = bfs(graph.entryNodeId(), outgoing);

        List<BranchPoint> branchPoints = new ArrayList<>();
        List<CompilationWarning> warnings = new ArrayList<>();
        for (SourceNode node : graph.nodes()) {
            List<SourceEdge> edges = outgoing.getOrDefault(node.id(), List.of());
            if (edges.size() < 2) {
                continue;
            }
            Integer depth = depths.get(node.id());
            if (depth == null) {
                log.debug("Node '{}' has {} successors but is unreachable; not classified", node.id(), edges.size());
                continue;
            }

            BranchProximity proximity = depth <= maxRoutingDepth ? BranchProximity.NEAR : BranchProximity.DEEP;
            branchPoints.add(new BranchPoint(node.id(), depth, proximity, edges));
            log.debug("Branch point '{}' at depth {} with {} successors: {}", node.id(), depth, edges.size(), proximity);

            if (proximity == BranchProximity.DEEP) {
                CompilationWarning warning = new CompilationWarning(WarningKind.UNROUTED_BRANCH, node.id(),
                    "Branch point at depth " + depth + " exceeds routing depth " + maxRoutingDepth
                        + "; its " + edges.size() + " successors are wired directly and agents on unselected"
                        + " paths may execute redundantly");
                log.warn("{}", warning);
                warnings.add(warning);
            }
        }

        log.info("Found {} branch points ({} routed, {} deep)", branchPoints.size(),
            branchPoints.stream().filter(BranchPoint::isNear).count(),
            branchPoints.stream().filter(b -> !b.isNear()).count());
        return new BranchAnalysis(depths, branchPoints, maxRoutingDepth, warnings);
    }

    private static Map<String, Integer> bfs(String entryId, Map<String, List<SourceEdge>> outgoing) {
        Map<String, Integer> depths = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depths.put(entryId, 0);
        queue.add(entryId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = depths.get(current) + 1;
            for (SourceEdge edge : outgoing.getOrDefault(current, List.of())) {
                if (!depths.containsKey(edge.toNodeId())) {
                    depths.put(edge.toNodeId(), next);
                    queue.add(edge.toNodeId());
                }
            }
        }
        return depths;
    }
}
