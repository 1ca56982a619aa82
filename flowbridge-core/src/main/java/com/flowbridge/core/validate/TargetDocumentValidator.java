package com.flowbridge.core.validate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import com.flowbridge.core.palette.ComponentPayload;
import com.flowbridge.core.palette.PaletteLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-reads an emitted flow document and checks it against the palette.
 *
 * <p>Checks performed:
 * <ul>
 *   <li>every node has an id, ids are unique and {@code data.id} agrees with {@code id}</li>
 *   <li>every node's runtime type is provided by a palette blueprint</li>
 *   <li>every required field of that blueprint holds a usable value</li>
 *   <li>every edge names existing source and target nodes</li>
 *   <li>edge handles decode and name ports the blueprints declare</li>
 * </ul>
 */
public class TargetDocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(TargetDocumentValidator.class);

    private final PaletteLoader loader;
    private final ObjectMapper objectMapper;
    private final Map<String, ComponentBlueprint> blueprintsByRuntimeType = new HashMap<>();

    public TargetDocumentValidator(ComponentPaletteRegistry registry, PaletteLoader loader) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.objectMapper = new ObjectMapper();
        registry.blueprints().forEach(b -> blueprintsByRuntimeType.putIfAbsent(b.runtimeType(), b));
    }

    /**
     * Validates a serialized flow document.
     *
     * @param json document text
     * @return validation report; an unparseable document yields a single problem
     */
    public ValidationReport validate(String json) {
        try {
            return validate(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            return new ValidationReport(0, 0, List.of("Document is not valid JSON: " + e.getOriginalMessage()));
        }
    }

    /**
     * Validates a flow document tree.
     *
     * @param document document root
     * @return validation report
     */
    public ValidationReport validate(JsonNode document) {
        List<String> problems = new ArrayList<>();
        JsonNode nodes = document.path("data").path("nodes");
        JsonNode edges = document.path("data").path("edges");
        if (!nodes.isArray()) {
            problems.add("data.nodes is missing or not an array");
        }
        if (!edges.isArray()) {
            problems.add("data.edges is missing or not an array");
        }
        if (!problems.isEmpty()) {
            return new ValidationReport(0, 0, problems);
        }

        Map<String, ComponentBlueprint> nodeBlueprints = new HashMap<>();
        Map<String, Integer> seen = new HashMap<>();
        for (JsonNode node : nodes) {
            checkNode(node, seen, nodeBlueprints, problems);
        }
        for (JsonNode edge : edges) {
            checkEdge(edge, seen, nodeBlueprints, problems);
        }

        ValidationReport report = new ValidationReport(nodes.size(), edges.size(), problems);
        if (report.isValid()) {
            log.debug("Flow document valid: {} nodes, {} edges", nodes.size(), edges.size());
        } else {
            log.warn("Flow document has {} problem(s)", problems.size());
        }
        return report;
    }

    private void checkNode(JsonNode node, Map<String, Integer> seen,
                           Map<String, ComponentBlueprint> nodeBlueprints, List<String> problems) {
        String id = node.path("id").asText("");
        if (id.isBlank()) {
            problems.add("Node without id");
            return;
        }
        if (seen.merge(id, 1, Integer::sum) > 1) {
            problems.add("Duplicate node id '" + id + "'");
            return;
        }
        if (!id.equals(node.path("data").path("id").asText())) {
            problems.add("Node '" + id + "' has mismatched data.id '" + node.path("data").path("id").asText() + "'");
        }

        Optional<String> runtimeType = ComponentPayload.runtimeType(node);
        ComponentBlueprint blueprint = runtimeType.map(blueprintsByRuntimeType::get).orElse(null);
        if (blueprint == null) {
            problems.add("Node '" + id + "' has runtime type '" + runtimeType.orElse("")
                + "' which no palette blueprint provides");
            return;
        }
        nodeBlueprints.put(id, blueprint);

        for (String field : blueprint.requiredFields().keySet()) {
            String problem = loader.describeInvalidValue(ComponentPayload.fieldValue(node, field).orElse(null));
            if (problem != null) {
                problems.add("Node '" + id + "' required field '" + field + "': " + problem);
            }
        }
    }

    private void checkEdge(JsonNode edge, Map<String, Integer> seen,
                           Map<String, ComponentBlueprint> nodeBlueprints, List<String> problems) {
        String source = edge.path("source").asText("");
        String target = edge.path("target").asText("");
        String label = "Edge " + source + " -> " + target;
        if (!seen.containsKey(source)) {
            problems.add(label + ": unknown source node");
        }
        if (!seen.containsKey(target)) {
            problems.add(label + ": unknown target node");
        }

        JsonNode sourceHandle = decodeHandle(edge, "sourceHandle", label, problems);
        JsonNode targetHandle = decodeHandle(edge, "targetHandle", label, problems);

        ComponentBlueprint sourceBlueprint = nodeBlueprints.get(source);
        if (sourceHandle != null && sourceBlueprint != null) {
            String port = sourceHandle.path("name").asText();
            if (sourceBlueprint.findOutput(port).isEmpty()) {
                problems.add(label + ": " + sourceBlueprint.runtimeType() + " has no output port '" + port + "'");
            }
        }
        ComponentBlueprint targetBlueprint = nodeBlueprints.get(target);
        if (targetHandle != null && targetBlueprint != null) {
            String port = targetHandle.path("fieldName").asText();
            if (targetBlueprint.findInput(port).isEmpty()) {
                problems.add(label + ": " + targetBlueprint.runtimeType() + " has no input port '" + port + "'");
            }
        }
    }

    private JsonNode decodeHandle(JsonNode edge, String field, String label, List<String> problems) {
        JsonNode handle = edge.path(field);
        if (!handle.isTextual()) {
            problems.add(label + ": " + field + " is not an encoded string");
            return null;
        }
        try {
            return objectMapper.readTree(handle.asText());
        } catch (JsonProcessingException e) {
            problems.add(label + ": " + field + " does not decode: " + e.getOriginalMessage());
            return null;
        }
    }
}
