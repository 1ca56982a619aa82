package com.flowbridge.core.model;

import java.util.Objects;

/**
 * A typed wire between an output port of one instance and an input port of another.
 *
 * @param sourceInstanceId producing instance
 * @param sourceOutputPort output port as declared by the producer's blueprint
 * @param targetInstanceId consuming instance
 * @param targetInputPort input port as declared by the consumer's blueprint
 * @param kind connection origin
 * @param condition source transition guard carried for reference, null if none
 */
public record Connection(
    String sourceInstanceId,
    PortSpec sourceOutputPort,
    String targetInstanceId,
    PortSpec targetInputPort,
    ConnectionKind kind,
    EdgeCondition condition
) {
    /**
     * Compact constructor with validation.
     */
    public Connection {
        Objects.requireNonNull(sourceInstanceId, "sourceInstanceId must not be null");
        Objects.requireNonNull(sourceOutputPort, "sourceOutputPort must not be null");
        Objects.requireNonNull(targetInstanceId, "targetInstanceId must not be null");
        Objects.requireNonNull(targetInputPort, "targetInputPort must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns whether the connection touches the given instance on either end.
     *
     * @param instanceId instance id
     * @return true if the instance is the source or the target
     */
    public boolean references(String instanceId) {
        return sourceInstanceId.equals(instanceId) || targetInstanceId.equals(instanceId);
    }

    @Override
    public String toString() {
        return sourceInstanceId + "." + sourceOutputPort.name() + " -> "
            + targetInstanceId + "." + targetInputPort.name();
    }
}
