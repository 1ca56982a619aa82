package com.flowbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only template describing one target component type.
 *
 * <p>The payload is the runtime's own node document and is treated as opaque: the compiler
 * only ever deep-copies it and rewrites the fields named in {@code fieldBindings}. The
 * record hands out copies of its JSON content so a blueprint cannot be changed after load.
 *
 * @param componentType compiler-level type tag
 * @param runtimeType type tag the target runtime uses for this component (e.g. "ConditionalRouter")
 * @param displayName default display name
 * @param requiredFields fields the runtime needs to execute the component, with their default values
 * @param fieldBindings palette field names for the fields the compiler overrides
 * @param inputPorts declared input ports, in order
 * @param outputPorts declared output ports, in order
 * @param payload full runtime node document
 */
public record ComponentBlueprint(
    ComponentType componentType,
    String runtimeType,
    String displayName,
    Map<String, JsonNode> requiredFields,
    Map<OverridableField, String> fieldBindings,
    List<PortSpec> inputPorts,
    List<PortSpec> outputPorts,
    ObjectNode payload
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentBlueprint {
        Objects.requireNonNull(componentType, "componentType must not be null");
        Objects.requireNonNull(runtimeType, "runtimeType must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (displayName == null) {
            displayName = runtimeType;
        }
        requiredFields = copyFields(requiredFields);
        fieldBindings = fieldBindings == null || fieldBindings.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(fieldBindings));
        inputPorts = inputPorts == null ? List.of() : List.copyOf(inputPorts);
        outputPorts = outputPorts == null ? List.of() : List.copyOf(outputPorts);
        payload = payload.deepCopy();
    }

    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }

    @Override
    public Map<String, JsonNode> requiredFields() {
        return copyFields(requiredFields);
    }

    /**
     * Finds a declared input port by name.
     *
     * @param name port name
     * @return the port, or empty if the blueprint does not declare it
     */
    public Optional<PortSpec> findInput(String name) {
        return inputPorts.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Finds a declared output port by name.
     *
     * @param name port name
     * @return the port, or empty if the blueprint does not declare it
     */
    public Optional<PortSpec> findOutput(String name) {
        return outputPorts.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Finds the first input port with the given role.
     *
     * @param role wiring role
     * @return the port, or empty
     */
    public Optional<PortSpec> inputForRole(PortRole role) {
        return inputPorts.stream().filter(p -> p.role() == role).findFirst();
    }

    /**
     * Finds the first output port with the given role.
     *
     * @param role wiring role
     * @return the port, or empty
     */
    public Optional<PortSpec> outputForRole(PortRole role) {
        return outputPorts.stream().filter(p -> p.role() == role).findFirst();
    }

    /**
     * Returns the palette field name bound to an overridable field.
     *
     * @param field overridable field
     * @return bound field name, or empty if this blueprint has no such field
     */
    public Optional<String> boundField(OverridableField field) {
        return Optional.ofNullable(fieldBindings.get(field));
    }

    private static Map<String, JsonNode> copyFields(Map<String, JsonNode> fields) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> copy.put(name, value == null ? null : value.deepCopy()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
