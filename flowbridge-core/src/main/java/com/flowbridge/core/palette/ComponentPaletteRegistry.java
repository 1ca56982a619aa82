package com.flowbridge.core.palette;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowbridge.core.error.PaletteLookupException;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.OverridableField;
import com.flowbridge.core.model.PortRole;
import com.flowbridge.core.model.PortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of component blueprints, keyed by component type.
 *
 * <p>Every instance the compiler emits is produced by {@link #clone(ComponentType, String)}: a deep
 * copy of the blueprint payload with a fresh id. Afterwards only the fields the compiler owns are
 * rewritten, through {@link #override} and {@link #setParameter}; every other field, including the
 * required implementation fields, travels to the output untouched.
 *
 * <p>The registry checks each blueprint's port roles when it is built so wiring never has to
 * guess a port name:
 * <ul>
 *   <li>EntryPoint: a primary output</li>
 *   <li>ConversationAgent: a primary input, a primary output and an instruction binding</li>
 *   <li>BinaryGate: a primary input, a match output, a no-match output and a match-text binding</li>
 *   <li>ExitPoint: a primary input</li>
 * </ul>
 */
public class ComponentPaletteRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentPaletteRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<ComponentType, ComponentBlueprint> blueprints = new EnumMap<>(ComponentType.class);

    /**
     * Creates a registry over the given blueprints.
     *
     * @param blueprints loaded blueprints, at most one per component type
     * @throws PaletteLookupException if a type is declared twice or a blueprint lacks a port role
     *                                or binding the compiler needs
     */
    public ComponentPaletteRegistry(Collection<ComponentBlueprint> blueprints) {
        for (ComponentBlueprint blueprint : blueprints) {
            ComponentBlueprint previous = this.blueprints.putIfAbsent(blueprint.componentType(), blueprint);
            if (previous != null) {
                throw new PaletteLookupException("Palette declares " + blueprint.componentType().documentName()
                    + " twice (" + previous.runtimeType() + ", " + blueprint.runtimeType() + ")");
            }
            checkContract(blueprint);
        }
    }

    /**
     * Returns the blueprint for a component type. Classifiers resolve to the ConversationAgent blueprint.
     *
     * @param type component type
     * @return the blueprint
     * @throws PaletteLookupException if the palette has no blueprint for the type
     */
    public ComponentBlueprint getBlueprint(ComponentType type) {
        ComponentBlueprint blueprint = blueprints.get(type.blueprintSource());
        if (blueprint == null) {
            throw new PaletteLookupException("Palette has no blueprint for component type "
                + type.blueprintSource().documentName()
                + (type != type.blueprintSource() ? " (needed for " + type.documentName() + ")" : ""));
        }
        return blueprint;
    }

    /**
     * Returns whether the palette can produce the component type.
     *
     * @param type component type
     * @return true if a blueprint exists
     */
    public boolean supports(ComponentType type) {
        return blueprints.containsKey(type.blueprintSource());
    }

    /**
     * Returns the component types the palette declares.
     *
     * @return declared types in enum order
     */
    public Set<ComponentType> types() {
        Set<ComponentType> types = EnumSet.noneOf(ComponentType.class);
        types.addAll(blueprints.keySet());
        return Collections.unmodifiableSet(types);
    }

    /**
     * Returns all blueprints in component type order.
     *
     * @return blueprints
     */
    public List<ComponentBlueprint> blueprints() {
        return List.copyOf(blueprints.values());
    }

    /**
     * Clones a blueprint into a fresh instance.
     *
     * @param type component type of the new instance
     * @param id unique instance id
     * @return instance carrying a deep copy of the blueprint payload
     */
    public ComponentInstance clone(ComponentType type, String id) {
        ComponentBlueprint blueprint = getBlueprint(type);
        ObjectNode payload = blueprint.payload();
        ComponentPayload.stamp(payload, id, blueprint.displayName(), null);
        log.debug("Cloned {} as {} ({})", blueprint.runtimeType(), id, type.documentName());
        return new ComponentInstance(id, type, blueprint.runtimeType(), blueprint.displayName(),
            null, null, null, payload);
    }

    /**
     * Rewrites one of the compiler-owned fields of an instance.
     *
     * @param instance instance to update
     * @param field overridable field
     * @param value new text value
     * @return updated instance
     * @throws PaletteLookupException if the instance's blueprint does not bind the field
     */
    public ComponentInstance override(ComponentInstance instance, OverridableField field, String value) {
        ComponentBlueprint blueprint = getBlueprint(instance.componentType());
        String fieldName = blueprint.boundField(field)
            .orElseThrow(() -> new PaletteLookupException("Blueprint " + blueprint.runtimeType()
                + " has no " + field.bindingKey() + " binding (instance " + instance.id() + ")"));
        ObjectNode payload = instance.payload().deepCopy();
        ComponentPayload.setFieldValue(payload, fieldName, TextNode.valueOf(value));
        return instance.withPayload(payload);
    }

    /**
     * Sets a runtime parameter on an instance if its template declares the field.
     *
     * @param instance instance to update
     * @param fieldName template field name
     * @param value new value (string, number or boolean)
     * @return updated instance, or the same instance if the template lacks the field
     */
    public ComponentInstance setParameter(ComponentInstance instance, String fieldName, Object value) {
        if (!ComponentPayload.hasField(instance.payload(), fieldName)) {
            log.debug("{} has no field '{}', parameter skipped", instance.runtimeType(), fieldName);
            return instance;
        }
        ObjectNode payload = instance.payload().deepCopy();
        ComponentPayload.setFieldValue(payload, fieldName, MAPPER.valueToTree(value));
        return instance.withPayload(payload);
    }

    /**
     * Finds an input port of a component type by name.
     *
     * @param type component type
     * @param name port name
     * @return the port, or empty
     */
    public Optional<PortSpec> findInput(ComponentType type, String name) {
        return getBlueprint(type).findInput(name);
    }

    /**
     * Finds an output port of a component type by name.
     *
     * @param type component type
     * @param name port name
     * @return the port, or empty
     */
    public Optional<PortSpec> findOutput(ComponentType type, String name) {
        return getBlueprint(type).findOutput(name);
    }

    /**
     * Returns the input port playing a role.
     *
     * @param type component type
     * @param role port role
     * @return the port
     * @throws PaletteLookupException if the blueprint declares no input with that role
     */
    public PortSpec inputForRole(ComponentType type, PortRole role) {
        ComponentBlueprint blueprint = getBlueprint(type);
        return blueprint.inputForRole(role)
            .orElseThrow(() -> new PaletteLookupException("Blueprint " + blueprint.runtimeType()
                + " declares no " + role + " input port"));
    }

    /**
     * Returns the output port playing a role.
     *
     * @param type component type
     * @param role port role
     * @return the port
     * @throws PaletteLookupException if the blueprint declares no output with that role
     */
    public PortSpec outputForRole(ComponentType type, PortRole role) {
        ComponentBlueprint blueprint = getBlueprint(type);
        return blueprint.outputForRole(role)
            .orElseThrow(() -> new PaletteLookupException("Blueprint " + blueprint.runtimeType()
                + " declares no " + role + " output port"));
    }

    /**
     * Lists the required fields of an instance that are no longer usable.
     *
     * @param instance instance to inspect
     * @param loader loader whose placeholder markers apply
     * @return one message per missing, blank or placeholder field; empty if all are intact
     */
    public List<String> requiredFieldProblems(ComponentInstance instance, PaletteLoader loader) {
        List<String> problems = new ArrayList<>();
        getBlueprint(instance.componentType()).requiredFields().keySet().forEach(field -> {
            JsonNode value = ComponentPayload.fieldValue(instance.payload(), field).orElse(null);
            String problem = loader.describeInvalidValue(value);
            if (problem != null) {
                problems.add(instance.id() + "." + field + ": " + problem);
            }
        });
        return problems;
    }

    private static void checkContract(ComponentBlueprint blueprint) {
        switch (blueprint.componentType()) {
            case ENTRY_POINT -> requireOutputRole(blueprint, PortRole.PRIMARY);
            case CONVERSATION_AGENT -> {
                requireInputRole(blueprint, PortRole.PRIMARY);
                requireOutputRole(blueprint, PortRole.PRIMARY);
                requireBinding(blueprint, OverridableField.INSTRUCTION);
            }
            case BINARY_GATE -> {
                requireInputRole(blueprint, PortRole.PRIMARY);
                requireOutputRole(blueprint, PortRole.MATCH);
                requireOutputRole(blueprint, PortRole.NO_MATCH);
                requireBinding(blueprint, OverridableField.MATCH_TEXT);
            }
            case EXIT_POINT -> requireInputRole(blueprint, PortRole.PRIMARY);
            default -> {
                // classifier blueprints are never registered
            }
        }
    }

    private static void requireInputRole(ComponentBlueprint blueprint, PortRole role) {
        if (blueprint.inputForRole(role).isEmpty()) {
            throw new PaletteLookupException("Blueprint " + blueprint.componentType().documentName()
                + " (" + blueprint.runtimeType() + ") must declare a " + role + " input port");
        }
    }

    private static void requireOutputRole(ComponentBlueprint blueprint, PortRole role) {
        if (blueprint.outputForRole(role).isEmpty()) {
            throw new PaletteLookupException("Blueprint " + blueprint.componentType().documentName()
                + " (" + blueprint.runtimeType() + ") must declare a " + role + " output port");
        }
    }

    private static void requireBinding(ComponentBlueprint blueprint, OverridableField field) {
        if (blueprint.boundField(field).isEmpty()) {
            throw new PaletteLookupException("Blueprint " + blueprint.componentType().documentName()
                + " (" + blueprint.runtimeType() + ") must bind the " + field.bindingKey() + " field");
        }
    }
}
