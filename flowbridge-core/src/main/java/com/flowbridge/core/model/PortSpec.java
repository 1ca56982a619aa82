package com.flowbridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, typed input or output port declared by a blueprint.
 *
 * @param name port name exactly as the target runtime declares it
 * @param dataKinds data kinds the port produces (output) or accepts (input), in declared order
 * @param fieldType runtime field type tag for inputs (e.g. "str", "other"), null for outputs
 * @param role wiring role
 */
public record PortSpec(
    String name,
    List<String> dataKinds,
    String fieldType,
    PortRole role
) {
    /**
     * Compact constructor with validation.
     */
    public PortSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataKinds, "dataKinds must not be null");
        if (dataKinds.isEmpty()) {
            throw new IllegalArgumentException("Port '" + name + "' must declare at least one data kind");
        }
        dataKinds = List.copyOf(dataKinds);
        if (role == null) {
            role = PortRole.AUXILIARY;
        }
    }

    /**
     * Returns whether data produced by this port can be consumed by the given port.
     *
     * @param other the port on the other end of a connection
     * @return true if the two ports share at least one data kind
     */
    public boolean isCompatibleWith(PortSpec other) {
        return dataKinds.stream().anyMatch(other.dataKinds()::contains);
    }
}
