package com.flowbridge.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A concrete component in the target graph: a blueprint clone with its own identity.
 *
 * @param id unique instance id
 * @param componentType compiler-level type tag
 * @param runtimeType runtime type tag copied from the blueprint
 * @param displayName name shown in the runtime editor
 * @param position editor position
 * @param description optional description, null if none
 * @param sourceNodeId id of the source node this instance implements, null for synthesized components
 * @param payload cloned runtime node document with overridden field values
 */
public record ComponentInstance(
    String id,
    ComponentType componentType,
    String runtimeType,
    String displayName,
    Position position,
    String description,
    String sourceNodeId,
    ObjectNode payload
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentInstance {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(componentType, "componentType must not be null");
        Objects.requireNonNull(runtimeType, "runtimeType must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (displayName == null) {
            displayName = runtimeType;
        }
        if (position == null) {
            position = Position.ORIGIN;
        }
    }

    /**
     * Returns a copy placed at another position.
     *
     * @param newPosition new editor position
     * @return relocated instance
     */
    public ComponentInstance withPosition(Position newPosition) {
        return new ComponentInstance(id, componentType, runtimeType, displayName, newPosition,
            description, sourceNodeId, payload);
    }

    /**
     * Returns a copy with another display name.
     *
     * @param newDisplayName display name
     * @return renamed instance
     */
    public ComponentInstance withDisplayName(String newDisplayName) {
        return new ComponentInstance(id, componentType, runtimeType, newDisplayName, position,
            description, sourceNodeId, payload);
    }

    /**
     * Returns a copy with another description.
     *
     * @param newDescription description text
     * @return updated instance
     */
    public ComponentInstance withDescription(String newDescription) {
        return new ComponentInstance(id, componentType, runtimeType, displayName, position,
            newDescription, sourceNodeId, payload);
    }

    /**
     * Returns a copy bound to a source node.
     *
     * @param nodeId source node id
     * @return updated instance
     */
    public ComponentInstance withSourceNodeId(String nodeId) {
        return new ComponentInstance(id, componentType, runtimeType, displayName, position,
            description, nodeId, payload);
    }

    /**
     * Returns a copy carrying another payload.
     *
     * @param newPayload runtime node document
     * @return updated instance
     */
    public ComponentInstance withPayload(ObjectNode newPayload) {
        return new ComponentInstance(id, componentType, runtimeType, displayName, position,
            description, sourceNodeId, newPayload);
    }
}
