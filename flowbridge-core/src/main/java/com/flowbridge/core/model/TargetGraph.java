package com.flowbridge.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled pipeline graph ready for emission.
 *
 * @param name flow name
 * @param entryInstanceId entry sentinel instance id
 * @param exitInstanceId exit sentinel instance id
 * @param instances component instances
 * @param connections typed connections
 */
public record TargetGraph(
    String name,
    String entryInstanceId,
    String exitInstanceId,
    List<ComponentInstance> instances,
    List<Connection> connections
) {
    /**
     * Compact constructor with validation.
     */
    public TargetGraph {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(entryInstanceId, "entryInstanceId must not be null");
        Objects.requireNonNull(exitInstanceId, "exitInstanceId must not be null");
        instances = instances == null ? List.of() : List.copyOf(instances);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /**
     * Looks up an instance by id.
     *
     * @param instanceId instance id
     * @return the instance, or empty
     */
    public Optional<ComponentInstance> instance(String instanceId) {
        return instances.stream().filter(i -> i.id().equals(instanceId)).findFirst();
    }

    /**
     * Returns the instances of one component type.
     *
     * @param type component type
     * @return matching instances in emission order
     */
    public List<ComponentInstance> instancesOfType(ComponentType type) {
        return instances.stream().filter(i -> i.componentType() == type).toList();
    }

    /**
     * Returns the instance implementing a source node.
     *
     * @param sourceNodeId source node id
     * @return the instance, or empty if the node was not compiled
     */
    public Optional<ComponentInstance> instanceForNode(String sourceNodeId) {
        return instances.stream().filter(i -> sourceNodeId.equals(i.sourceNodeId())).findFirst();
    }

    /**
     * Returns the connections leaving an instance.
     *
     * @param instanceId producing instance id
     * @return outgoing connections
     */
    public List<Connection> outgoing(String instanceId) {
        return connections.stream().filter(c -> c.sourceInstanceId().equals(instanceId)).toList();
    }

    /**
     * Returns the connections entering an instance.
     *
     * @param instanceId consuming instance id
     * @return incoming connections
     */
    public List<Connection> incoming(String instanceId) {
        return connections.stream().filter(c -> c.targetInstanceId().equals(instanceId)).toList();
    }
}
