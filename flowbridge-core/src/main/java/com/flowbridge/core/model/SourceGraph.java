package com.flowbridge.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed and validated source conversational workflow.
 *
 * <p>Orphan nodes (extra nodes without incoming transitions) are already removed from
 * {@code nodes} and {@code edges}; their ids are kept for reporting.
 *
 * @param name workflow name
 * @param nodes included nodes in document order
 * @param edges included transitions in document order
 * @param entryNodeId id of the conversational entry node
 * @param orphanNodeIds ids of excluded orphan nodes
 */
public record SourceGraph(
    String name,
    List<SourceNode> nodes,
    List<SourceEdge> edges,
    String entryNodeId,
    Set<String> orphanNodeIds
) {
    /**
     * Compact constructor with validation.
     */
    public SourceGraph {
        Objects.requireNonNull(entryNodeId, "entryNodeId must not be null");
        if (name == null || name.isBlank()) {
            name = "Converted Workflow";
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        orphanNodeIds = orphanNodeIds == null ? Set.of() : Set.copyOf(orphanNodeIds);
    }

    /**
     * Looks up a node by id.
     *
     * @param nodeId node identifier
     * @return the node, or empty if not part of the graph
     */
    public Optional<SourceNode> node(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    /**
     * Returns the entry node.
     *
     * @return entry node
     */
    public SourceNode entryNode() {
        return node(entryNodeId)
            .orElseThrow(() -> new IllegalStateException("Entry node not in graph: " + entryNodeId));
    }

    /**
     * Returns the outgoing transitions of a node in document order.
     *
     * @param nodeId node identifier
     * @return outgoing edges
     */
    public List<SourceEdge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.fromNodeId().equals(nodeId)).toList();
    }

    /**
     * Groups outgoing transitions by source node, preserving document order.
     *
     * @return map of node id to its outgoing edges (nodes without edges are absent)
     */
    public Map<String, List<SourceEdge>> outgoingByNode() {
        Map<String, List<SourceEdge>> grouped = new LinkedHashMap<>();
        for (SourceEdge edge : edges) {
            grouped.computeIfAbsent(edge.fromNodeId(), k -> new ArrayList<>()).add(edge);
        }
        return grouped;
    }
}
