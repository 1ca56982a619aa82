package com.flowbridge.core.palette;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Navigation helpers for the runtime node documents carried by blueprints and instances.
 *
 * <p>Layout of a node document:
 * <pre>{@code
 * {
 *   "id": "ConditionalRouter-3f2a1",
 *   "type": "genericNode",
 *   "position": {"x": 0, "y": 0},
 *   "data": {
 *     "id": "ConditionalRouter-3f2a1",
 *     "type": "ConditionalRouter",
 *     "node": {
 *       "display_name": "If-Else",
 *       "description": "...",
 *       "template": {
 *         "match_text": {"value": "1", "type": "str", ...},
 *         "code": {"value": "class ConditionalRouter...", ...}
 *       }
 *     }
 *   }
 * }
 * }</pre>
 */
public final class ComponentPayload {

    private static final String DATA = "data";
    private static final String NODE = "node";
    private static final String TEMPLATE = "template";
    private static final String VALUE = "value";

    private ComponentPayload() {
        // Utility class
    }

    /**
     * Returns the runtime type tag ({@code data.type}).
     *
     * @param payload node document
     * @return runtime type, or empty if absent
     */
    public static Optional<String> runtimeType(JsonNode payload) {
        JsonNode type = payload.path(DATA).path("type");
        return type.isTextual() && !type.asText().isBlank() ? Optional.of(type.asText()) : Optional.empty();
    }

    /**
     * Returns the component's display name ({@code data.node.display_name}).
     *
     * @param payload node document
     * @return display name, or empty if absent
     */
    public static Optional<String> displayName(JsonNode payload) {
        JsonNode name = payload.path(DATA).path(NODE).path("display_name");
        return name.isTextual() ? Optional.of(name.asText()) : Optional.empty();
    }

    /**
     * Returns the configuration field map ({@code data.node.template}).
     *
     * @param payload node document
     * @return template object, or a missing node
     */
    public static JsonNode template(JsonNode payload) {
        return payload.path(DATA).path(NODE).path(TEMPLATE);
    }

    /**
     * Returns whether the template declares a field.
     *
     * @param payload node document
     * @param field field name
     * @return true if the field exists
     */
    public static boolean hasField(JsonNode payload, String field) {
        return template(payload).has(field);
    }

    /**
     * Returns a field's value ({@code template.<field>.value}).
     *
     * @param payload node document
     * @param field field name
     * @return value node, or empty if the field or its value is absent
     */
    public static Optional<JsonNode> fieldValue(JsonNode payload, String field) {
        JsonNode value = template(payload).path(field).path(VALUE);
        return value.isMissingNode() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Sets a field's value in place, keeping every other attribute of the field.
     *
     * @param payload node document (modified)
     * @param field field name, must exist in the template
     * @param value new value
     * @throws IllegalArgumentException if the template does not declare the field
     */
    public static void setFieldValue(ObjectNode payload, String field, JsonNode value) {
        JsonNode fieldNode = template(payload).path(field);
        if (!(fieldNode instanceof ObjectNode fieldObject)) {
            throw new IllegalArgumentException("Template has no field '" + field + "'");
        }
        fieldObject.set(VALUE, value);
    }

    /**
     * Writes the identity and editor metadata of an instance into its node document.
     *
     * @param payload node document (modified)
     * @param id instance id
     * @param displayName display name
     * @param description description, null to leave the blueprint's description
     */
    public static void stamp(ObjectNode payload, String id, String displayName, String description) {
        payload.put("id", id);
        ObjectNode data = child(payload, DATA);
        data.put("id", id);
        ObjectNode node = child(data, NODE);
        node.put("display_name", displayName);
        if (description != null) {
            node.put("description", description);
        }
    }

    /**
     * Writes the editor position into a node document.
     *
     * @param payload node document (modified)
     * @param x horizontal coordinate
     * @param y vertical coordinate
     */
    public static void place(ObjectNode payload, double x, double y) {
        ObjectNode position = JsonNodeFactory.instance.objectNode();
        position.put("x", x);
        position.put("y", y);
        payload.set("position", position);
    }

    private static ObjectNode child(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        if (existing instanceof ObjectNode object) {
            return object;
        }
        return parent.putObject(name);
    }
}
