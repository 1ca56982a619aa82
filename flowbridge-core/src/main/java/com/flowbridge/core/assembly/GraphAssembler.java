package com.flowbridge.core.assembly;

import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.Connection;
import com.flowbridge.core.model.TargetGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects instances and connections and turns them into the final {@link TargetGraph}.
 *
 * <p>{@link #assemble} prunes unreachable instances and then checks the invariants every emitted
 * graph must satisfy. A violation is a compiler defect, reported as {@link IllegalStateException}.
 */
public class GraphAssembler {

    private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

    private final String name;
    private final List<ComponentInstance> instances = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final OrphanPruner pruner;

    public GraphAssembler(String name) {
        this(name, new OrphanPruner());
    }

    public GraphAssembler(String name, OrphanPruner pruner) {
        this.name = name;
        this.pruner = pruner;
    }

    public GraphAssembler add(ComponentInstance instance) {
        instances.add(instance);
        return this;
    }

    public GraphAssembler addAll(Collection<ComponentInstance> more) {
        instances.addAll(more);
        return this;
    }

    public GraphAssembler connect(Connection connection) {
        connections.add(connection);
        return this;
    }

    public GraphAssembler connectAll(Collection<Connection> more) {
        connections.addAll(more);
        return this;
    }

    /**
     * Returns the instances added so far, keyed by id, in insertion order.
     *
     * @return instance map
     */
    public Map<String, ComponentInstance> instancesById() {
        Map<String, ComponentInstance> byId = new LinkedHashMap<>();
        instances.forEach(i -> byId.put(i.id(), i));
        return byId;
    }

    /**
     * Prunes and verifies the graph.
     *
     * @param entryInstanceId entry sentinel id
     * @param exitInstanceId exit sentinel id
     * @return final graph and pruning warnings
     * @throws IllegalStateException if ids are duplicated or a connection names a missing instance
     */
    public AssemblyResult assemble(String entryInstanceId, String exitInstanceId) {
        TargetGraph draft = new TargetGraph(name, entryInstanceId, exitInstanceId, instances, connections);
        verifyIntegrity(draft);
        AssemblyResult result = pruner.prune(draft);
        verifyIntegrity(result.graph());
        log.debug("Assembled '{}': {} instances, {} connections", name,
            result.graph().instances().size(), result.graph().connections().size());
        return result;
    }

    /**
     * Checks that instance ids are unique, both sentinels exist and every connection names existing instances.
     *
     * @param graph graph to check
     * @throws IllegalStateException on the first violation
     */
    public static void verifyIntegrity(TargetGraph graph) {
        Set<String> ids = new HashSet<>();
        for (ComponentInstance instance : graph.instances()) {
            if (!ids.add(instance.id())) {
                throw new IllegalStateException("Duplicate instance id '" + instance.id() + "'");
            }
        }
        if (!ids.contains(graph.entryInstanceId())) {
            throw new IllegalStateException("Entry instance '" + graph.entryInstanceId() + "' is missing");
        }
        if (!ids.contains(graph.exitInstanceId())) {
            throw new IllegalStateException("Exit instance '" + graph.exitInstanceId() + "' is missing");
        }
        for (Connection connection : graph.connections()) {
            if (!ids.contains(connection.sourceInstanceId()) || !ids.contains(connection.targetInstanceId())) {
                throw new IllegalStateException("Connection " + connection + " references a missing instance");
            }
        }
    }
}
