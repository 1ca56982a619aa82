package com.flowbridge.core.assembly;

import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.Connection;
import com.flowbridge.core.model.TargetGraph;
import com.flowbridge.core.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes instances that cannot receive data from the entry sentinel.
 *
 * <p>Reachability follows connections forward from the entry sentinel. The exit sentinel is kept
 * even when nothing reaches it. A removed instance takes every connection naming it along.
 */
public class OrphanPruner {

    private static final Logger log = LoggerFactory.getLogger(OrphanPruner.class);

    /**
     * Prunes unreachable instances.
     *
     * @param draft assembled graph before pruning
     * @return pruned graph and one {@link WarningKind#ORPHAN_INSTANCE} warning per removed instance
     */
    public AssemblyResult prune(TargetGraph draft) {
        Set<String> reachable = reachableFrom(draft.entryInstanceId(), draft.connections());
        reachable.add(draft.exitInstanceId());

        List<CompilationWarning> warnings = new ArrayList<>();
        List<ComponentInstance> kept = new ArrayList<>();
        for (ComponentInstance instance : draft.instances()) {
            if (reachable.contains(instance.id())) {
                kept.add(instance);
                continue;
            }
            String origin = instance.sourceNodeId() != null
                ? "clone of source node '" + instance.sourceNodeId() + "'"
                : "synthesized " + instance.componentType().documentName();
            CompilationWarning warning = new CompilationWarning(WarningKind.ORPHAN_INSTANCE, instance.id(),
                "Unreachable from the entry point (" + origin + "); removed with its connections");
            log.warn("{}", warning);
            warnings.add(warning);
        }

        List<Connection> connections = draft.connections().stream()
            .filter(c -> reachable.contains(c.sourceInstanceId()) && reachable.contains(c.targetInstanceId()))
            .toList();

        if (!warnings.isEmpty()) {
            log.info("Pruned {} unreachable instance(s) and {} connection(s)", warnings.size(),
                draft.connections().size() - connections.size());
        }
        return new AssemblyResult(new TargetGraph(draft.name(), draft.entryInstanceId(), draft.exitInstanceId(),
            kept, connections), warnings);
    }

    private static Set<String> reachableFrom(String entryId, List<Connection> connections) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Connection connection : connections) {
            adjacency.computeIfAbsent(connection.sourceInstanceId(), k -> new ArrayList<>())
                .add(connection.targetInstanceId());
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(entryId);
        queue.add(entryId);
        while (!queue.isEmpty()) {
            for (String next : adjacency.getOrDefault(queue.poll(), List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }
}
