package com.flowbridge.core.wiring;

import com.flowbridge.core.error.PaletteLookupException;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.Connection;
import com.flowbridge.core.model.ConnectionKind;
import com.flowbridge.core.model.EdgeCondition;
import com.flowbridge.core.model.PortRole;
import com.flowbridge.core.model.PortSpec;
import com.flowbridge.core.model.RoutedEdge;
import com.flowbridge.core.model.RoutingPlan;
import com.flowbridge.core.model.SourceEdge;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes typed connections between component instances.
 *
 * <p>Every port name comes from the palette blueprint of the instance at each end. A port that
 * the blueprint does not declare, or two ports without a common data kind, fail the compilation
 * with a {@link PaletteLookupException}; a connection is never dropped or renamed silently.
 */
public class WireBuilder {

    private static final Logger log = LoggerFactory.getLogger(WireBuilder.class);

    private final ComponentPaletteRegistry registry;

    public WireBuilder(ComponentPaletteRegistry registry) {
        this.registry = registry;
    }

    /**
     * Connects an output port of one instance to an input port of another.
     *
     * @param source producing instance
     * @param outputPort output port name on the source
     * @param target consuming instance
     * @param inputPort input port name on the target
     * @param kind connection category
     * @param condition condition metadata, may be null
     * @return the connection
     * @throws PaletteLookupException if a port is not declared or the data kinds are incompatible
     */
    public Connection connect(ComponentInstance source, String outputPort, ComponentInstance target,
                              String inputPort, ConnectionKind kind, EdgeCondition condition) {
        PortSpec out = registry.findOutput(source.componentType(), outputPort)
            .orElseThrow(() -> new PaletteLookupException("Component " + source.id() + " ("
                + source.runtimeType() + ") has no output port '" + outputPort + "'"));
        PortSpec in = registry.findInput(target.componentType(), inputPort)
            .orElseThrow(() -> new PaletteLookupException("Component " + target.id() + " ("
                + target.runtimeType() + ") has no input port '" + inputPort + "'"));
        if (!out.isCompatibleWith(in)) {
            throw new PaletteLookupException("Cannot connect " + source.id() + "." + outputPort + " "
                + out.dataKinds() + " to " + target.id() + "." + inputPort + " " + in.dataKinds()
                + ": no common data kind");
        }
        Connection connection = new Connection(source.id(), out, target.id(), in, kind, condition);
        log.debug("Wired {} ({})", connection, kind);
        return connection;
    }

    /**
     * Connects without condition metadata.
     *
     * @param source producing instance
     * @param outputPort output port name on the source
     * @param target consuming instance
     * @param inputPort input port name on the target
     * @param kind connection category
     * @return the connection
     */
    public Connection connect(ComponentInstance source, String outputPort, ComponentInstance target,
                              String inputPort, ConnectionKind kind) {
        return connect(source, outputPort, target, inputPort, kind, null);
    }

    /**
     * Connects the forward output of one instance to the primary input of another.
     *
     * @param source producing instance
     * @param target consuming instance
     * @param kind connection category
     * @param condition condition metadata, may be null
     * @return the connection
     */
    public Connection connectPrimary(ComponentInstance source, ComponentInstance target,
                                     ConnectionKind kind, EdgeCondition condition) {
        return connect(source, forwardOutput(source).name(), target,
            registry.inputForRole(target.componentType(), PortRole.PRIMARY).name(), kind, condition);
    }

    /**
     * Builds one connection per source edge not covered by a routing plan.
     *
     * @param graph source graph
     * @param nodeInstances instance per source node id
     * @param plans routing plans; their edges are skipped
     * @return successor connections in edge order
     */
    public List<Connection> successorConnections(SourceGraph graph, Map<String, ComponentInstance> nodeInstances,
                                                 List<RoutingPlan> plans) {
        Set<SourceEdge> routed = new HashSet<>();
        plans.forEach(plan -> plan.routedEdges().forEach(r -> routed.add(r.edge())));

        List<Connection> connections = new ArrayList<>();
        for (SourceEdge edge : graph.edges()) {
            if (routed.contains(edge)) {
                continue;
            }
            connections.add(connectPrimary(instanceFor(nodeInstances, edge.fromNodeId()),
                instanceFor(nodeInstances, edge.toNodeId()), ConnectionKind.SUCCESSOR, edge.condition()));
        }
        return connections;
    }

    /**
     * Builds the connections of one routing plan: branch point to classifier, classifier to the
     * first gate, the no-match chain between gates, and each gate leg to its successor.
     *
     * @param plan routing plan
     * @param instances every instance by id, including the plan's classifier and gates
     * @param nodeInstances instance per source node id
     * @return routing connections
     */
    public List<Connection> routingConnections(RoutingPlan plan, Map<String, ComponentInstance> instances,
                                               Map<String, ComponentInstance> nodeInstances) {
        List<Connection> connections = new ArrayList<>();
        ComponentInstance branchPoint = instanceFor(nodeInstances, plan.branchPointNodeId());
        ComponentInstance classifier = byId(instances, plan.classifierInstanceId());

        connections.add(connectPrimary(branchPoint, classifier, ConnectionKind.ROUTING, null));

        List<String> gateIds = plan.gateInstanceIds();
        connections.add(connectPrimary(classifier, byId(instances, gateIds.get(0)), ConnectionKind.ROUTING, null));

        for (int i = 0; i < gateIds.size() - 1; i++) {
            ComponentInstance gate = byId(instances, gateIds.get(i));
            ComponentInstance next = byId(instances, gateIds.get(i + 1));
            String noMatch = registry.outputForRole(gate.componentType(), PortRole.NO_MATCH).name();
            String input = registry.inputForRole(next.componentType(), PortRole.PRIMARY).name();
            connections.add(connect(gate, noMatch, next, input, ConnectionKind.ROUTING));
        }

        for (RoutedEdge leg : plan.routedEdges()) {
            ComponentInstance gate = byId(instances, leg.gateInstanceId());
            ComponentInstance successor = instanceFor(nodeInstances, leg.edge().toNodeId());
            String input = registry.inputForRole(successor.componentType(), PortRole.PRIMARY).name();
            connections.add(connect(gate, leg.outputPort(), successor, input, ConnectionKind.ROUTING));
        }
        return connections;
    }

    /**
     * Builds the sentinel connections: entry sentinel to the entry node, and every terminal node
     * to the exit sentinel. Terminal nodes compiled to exit points are exits themselves and are
     * not connected further.
     *
     * @param graph source graph
     * @param nodeInstances instance per source node id
     * @param entry entry sentinel
     * @param exit exit sentinel
     * @return sentinel connections
     */
    public List<Connection> sentinelConnections(SourceGraph graph, Map<String, ComponentInstance> nodeInstances,
                                                ComponentInstance entry, ComponentInstance exit) {
        List<Connection> connections = new ArrayList<>();
        connections.add(connectPrimary(entry, instanceFor(nodeInstances, graph.entryNodeId()),
            ConnectionKind.SENTINEL, null));

        Map<String, List<SourceEdge>> outgoing = graph.outgoingByNode();
        for (SourceNode node : graph.nodes()) {
            if (outgoing.containsKey(node.id())) {
                continue;
            }
            ComponentInstance terminal = instanceFor(nodeInstances, node.id());
            if (registry.getBlueprint(terminal.componentType()).outputForRole(PortRole.PRIMARY).isEmpty()) {
                log.debug("Terminal node '{}' compiles to {}, no exit connection", node.id(), terminal.runtimeType());
                continue;
            }
            connections.add(connectPrimary(terminal, exit, ConnectionKind.SENTINEL, null));
        }
        return connections;
    }

    /**
     * Returns the output an instance forwards data on: its primary output, else its first output.
     *
     * @param instance component instance
     * @return output port
     * @throws PaletteLookupException if the blueprint declares no outputs
     */
    public PortSpec forwardOutput(ComponentInstance instance) {
        ComponentBlueprint blueprint = registry.getBlueprint(instance.componentType());
        return blueprint.outputForRole(PortRole.PRIMARY)
            .or(() -> blueprint.outputPorts().stream().findFirst())
            .orElseThrow(() -> new PaletteLookupException("Component " + instance.id() + " ("
                + instance.runtimeType() + ") declares no output port"));
    }

    private static ComponentInstance instanceFor(Map<String, ComponentInstance> nodeInstances, String nodeId) {
        ComponentInstance instance = nodeInstances.get(nodeId);
        if (instance == null) {
            throw new IllegalStateException("No component instance for source node '" + nodeId + "'");
        }
        return instance;
    }

    private static ComponentInstance byId(Map<String, ComponentInstance> instances, String id) {
        ComponentInstance instance = instances.get(id);
        if (instance == null) {
            throw new IllegalStateException("Unknown component instance '" + id + "'");
        }
        return instance;
    }
}
