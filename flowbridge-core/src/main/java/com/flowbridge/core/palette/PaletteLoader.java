package com.flowbridge.core.palette;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowbridge.core.error.PaletteLookupException;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.OverridableField;
import com.flowbridge.core.model.PortRole;
import com.flowbridge.core.model.PortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads blueprint documents and builds a {@link ComponentPaletteRegistry}.
 *
 * <p>A palette source is a directory of {@code *.json} files, a single JSON file, or the
 * bundled classpath palette. Each file holds one blueprint object or an array of them:
 * <pre>{@code
 * {
 *   "componentType": "BinaryGate",
 *   "requiredFields": ["code"],
 *   "fieldBindings": {"matchText": "match_text", "operator": "operator"},
 *   "inputs":  [{"name": "input_text", "dataKinds": ["Message"], "fieldType": "str", "role": "primary"}],
 *   "outputs": [{"name": "true_result", "dataKinds": ["Message"], "role": "match"},
 *               {"name": "false_result", "dataKinds": ["Message"], "role": "noMatch"}],
 *   "node": { ... runtime node document ... }
 * }
 * }</pre>
 *
 * <p>Every required field must be present in the node template with a value that is neither
 * blank nor one of the configured placeholder markers.
 */
public class PaletteLoader {

    private static final Logger log = LoggerFactory.getLogger(PaletteLoader.class);

    /**
     * Classpath location of the palette shipped with the compiler.
     */
    public static final String BUNDLED_PALETTE = "palette/default-palette.json";

    private final ObjectMapper objectMapper;
    private final List<String> placeholderMarkers;

    /**
     * Creates a loader rejecting the given placeholder markers.
     *
     * @param placeholderMarkers values treated as "not configured", may be empty
     */
    public PaletteLoader(List<String> placeholderMarkers) {
        this(new ObjectMapper(), placeholderMarkers);
    }

    /**
     * Creates a loader with a custom object mapper.
     *
     * @param objectMapper mapper used to read blueprint documents
     * @param placeholderMarkers values treated as "not configured", may be empty
     */
    public PaletteLoader(ObjectMapper objectMapper, List<String> placeholderMarkers) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.placeholderMarkers = placeholderMarkers == null ? List.of() : List.copyOf(placeholderMarkers);
    }

    /**
     * Loads the palette from a directory or file, or the bundled palette when {@code source} is null.
     *
     * @param source palette directory or file, may be null
     * @return registry holding every loaded blueprint
     * @throws IOException if a palette file cannot be read
     * @throws PaletteLookupException if a blueprint is invalid
     */
    public ComponentPaletteRegistry load(Path source) throws IOException {
        if (source == null) {
            return loadBundled();
        }
        if (!Files.exists(source)) {
            throw new IOException("Palette source does not exist: " + source);
        }

        List<ComponentBlueprint> blueprints = new ArrayList<>();
        if (Files.isDirectory(source)) {
            List<Path> files;
            try (Stream<Path> stream = Files.list(source)) {
                files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
            }
            log.debug("Reading {} palette files from {}", files.size(), source);
            for (Path file : files) {
                blueprints.addAll(readBlueprints(objectMapper.readTree(file.toFile()), file.toString()));
            }
        } else {
            blueprints.addAll(readBlueprints(objectMapper.readTree(source.toFile()), source.toString()));
        }

        log.info("Loaded {} blueprints from {}", blueprints.size(), source);
        return new ComponentPaletteRegistry(blueprints);
    }

    /**
     * Loads the palette bundled on the classpath.
     *
     * @return registry holding the bundled blueprints
     * @throws IOException if the bundled palette is missing or unreadable
     */
    public ComponentPaletteRegistry loadBundled() throws IOException {
        try (InputStream in = PaletteLoader.class.getClassLoader().getResourceAsStream(BUNDLED_PALETTE)) {
            if (in == null) {
                throw new IOException("Bundled palette not found on classpath: " + BUNDLED_PALETTE);
            }
            List<ComponentBlueprint> blueprints = readBlueprints(objectMapper.readTree(in), BUNDLED_PALETTE);
            log.debug("Loaded {} bundled blueprints", blueprints.size());
            return new ComponentPaletteRegistry(blueprints);
        }
    }

    /**
     * Reads all blueprints from one palette document.
     *
     * @param root a blueprint object or an array of blueprint objects
     * @param origin name of the document for error messages
     * @return blueprints in document order, classifier documents excluded
     */
    public List<ComponentBlueprint> readBlueprints(JsonNode root, String origin) {
        List<ComponentBlueprint> blueprints = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("Palette document {} is empty", origin);
            return blueprints;
        }
        if (root.isArray()) {
            for (JsonNode element : root) {
                readBlueprint(element, origin).ifPresent(blueprints::add);
            }
        } else {
            readBlueprint(root, origin).ifPresent(blueprints::add);
        }
        return blueprints;
    }

    /**
     * Reads a single blueprint document.
     *
     * @param document blueprint object
     * @param origin name of the document for error messages
     * @return the blueprint, or empty if the document declares a classifier
     */
    public Optional<ComponentBlueprint> readBlueprint(JsonNode document, String origin) {
        if (!document.isObject()) {
            throw new PaletteLookupException("Palette entry in " + origin + " is not a JSON object");
        }

        String typeName = document.path("componentType").asText(null);
        ComponentType type = ComponentType.fromDocumentName(typeName)
            .orElseThrow(() -> new PaletteLookupException(
                "Unknown component type '" + typeName + "' in " + origin));

        if (type == ComponentType.CLASSIFIER) {
            log.warn("Ignoring Classifier blueprint in {}: classifiers are cloned from the {} blueprint",
                origin, ComponentType.CONVERSATION_AGENT.documentName());
            return Optional.empty();
        }

        JsonNode node = document.path("node");
        if (!(node instanceof ObjectNode payload)) {
            throw new PaletteLookupException("Blueprint " + type.documentName() + " in " + origin
                + " has no 'node' document");
        }
        String runtimeType = ComponentPayload.runtimeType(payload)
            .orElseThrow(() -> new PaletteLookupException("Blueprint " + type.documentName() + " in "
                + origin + " has no runtime type (data.type)"));
        String displayName = ComponentPayload.displayName(payload).orElse(runtimeType);

        Map<String, JsonNode> requiredFields = readRequiredFields(document, payload, type);
        Map<OverridableField, String> bindings = readBindings(document, payload, type);
        List<PortSpec> inputs = readPorts(document.path("inputs"), type, true);
        List<PortSpec> outputs = readPorts(document.path("outputs"), type, false);

        log.debug("Blueprint {} -> {} ({} inputs, {} outputs, {} required fields)",
            type.documentName(), runtimeType, inputs.size(), outputs.size(), requiredFields.size());
        return Optional.of(new ComponentBlueprint(type, runtimeType, displayName, requiredFields,
            bindings, inputs, outputs, payload));
    }

    private Map<String, JsonNode> readRequiredFields(JsonNode document, ObjectNode payload, ComponentType type) {
        Map<String, JsonNode> required = new LinkedHashMap<>();
        for (JsonNode nameNode : document.path("requiredFields")) {
            String field = nameNode.asText();
            JsonNode value = ComponentPayload.fieldValue(payload, field)
                .orElseThrow(() -> new PaletteLookupException("Blueprint " + type.documentName()
                    + " is missing required field '" + field + "'"));
            String problem = describeInvalidValue(value);
            if (problem != null) {
                throw new PaletteLookupException("Blueprint " + type.documentName()
                    + " has invalid required field '" + field + "': " + problem);
            }
            required.put(field, value);
        }
        return required;
    }

    /**
     * Describes why a required field value is unusable.
     *
     * @param value field value
     * @return problem description, or null if the value is usable
     */
    public String describeInvalidValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "value is null";
        }
        if (value.isTextual()) {
            String text = value.asText();
            if (text.isBlank()) {
                return "value is blank";
            }
            for (String marker : placeholderMarkers) {
                if (text.trim().equals(marker)) {
                    return "value is the placeholder '" + marker + "'";
                }
            }
        }
        if (value.isContainerNode() && value.isEmpty()) {
            return "value is empty";
        }
        return null;
    }

    private static Map<OverridableField, String> readBindings(JsonNode document, ObjectNode payload,
                                                             ComponentType type) {
        Map<OverridableField, String> bindings = new EnumMap<>(OverridableField.class);
        JsonNode bindingsNode = document.path("fieldBindings");
        for (OverridableField field : OverridableField.values()) {
            JsonNode bound = bindingsNode.path(field.bindingKey());
            if (!bound.isTextual()) {
                continue;
            }
            if (!ComponentPayload.hasField(payload, bound.asText())) {
                throw new PaletteLookupException("Blueprint " + type.documentName() + " binds "
                    + field.bindingKey() + " to '" + bound.asText() + "' which its template does not declare");
            }
            bindings.put(field, bound.asText());
        }
        return bindings;
    }

    private static List<PortSpec> readPorts(JsonNode portsNode, ComponentType type, boolean input) {
        List<PortSpec> ports = new ArrayList<>();
        for (JsonNode portNode : portsNode) {
            String name = portNode.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new PaletteLookupException("Blueprint " + type.documentName() + " declares an "
                    + (input ? "input" : "output") + " port without a name");
            }
            List<String> kinds = new ArrayList<>();
            portNode.path("dataKinds").forEach(k -> kinds.add(k.asText()));
            if (kinds.isEmpty()) {
                throw new PaletteLookupException("Port '" + name + "' of blueprint " + type.documentName()
                    + " declares no data kinds");
            }
            PortRole role;
            try {
                role = PortRole.parse(portNode.path("role").asText(null));
            } catch (IllegalArgumentException e) {
                throw new PaletteLookupException("Port '" + name + "' of blueprint " + type.documentName()
                    + " has unknown role '" + portNode.path("role").asText() + "'", e);
            }
            String fieldType = input ? portNode.path("fieldType").asText("str") : null;
            ports.add(new PortSpec(name, kinds, fieldType, role));
        }
        return ports;
    }
}
