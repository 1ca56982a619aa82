package com.flowbridge.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowbridge.core.error.StructuralException;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.ConditionKind;
import com.flowbridge.core.model.EdgeCondition;
import com.flowbridge.core.model.ExtractionField;
import com.flowbridge.core.model.FieldKind;
import com.flowbridge.core.model.Position;
import com.flowbridge.core.model.SideEffectKind;
import com.flowbridge.core.model.SourceEdge;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;
import com.flowbridge.core.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses conversational workflow documents into a validated {@link SourceGraph}.
 *
 * <p>Expected document shape:
 * <pre>{@code
 * {
 *   "workflow": {
 *     "name": "Dental Booking",
 *     "nodes": [
 *       {"name": "greeting", "type": "conversation", "isStart": true, "prompt": "...",
 *        "messagePlan": {"firstMessage": "Hi!"},
 *        "variableExtractionPlan": {"output": [{"title": "intent", "type": "string", "enum": ["book", "cancel"]}]},
 *        "metadata": {"position": {"x": 0, "y": 0}}},
 *       {"name": "hangup", "type": "tool", "tool": {"type": "endCall"}}
 *     ],
 *     "edges": [
 *       {"from": "greeting", "to": "hangup", "condition": {"type": "ai", "prompt": "User is done"}}
 *     ]
 *   }
 * }
 * }</pre>
 *
 * <p>Edges may name their endpoints by node id or by node name. The entry node is the node flagged
 * {@code isStart}, or else the only node without incoming edges. Other nodes without incoming edges
 * are orphans: they and every edge naming them are dropped with a warning.
 */
public class SourceGraphParser {

    private static final Logger log = LoggerFactory.getLogger(SourceGraphParser.class);

    private static final String TOOL_TYPE = "tool";
    private static final String CLASSIFIED_CONDITION_TYPE = "ai";
    private static final String TRANSFER_TOOL = "transferCall";

    private final ObjectMapper objectMapper;

    public SourceGraphParser() {
        this(new ObjectMapper());
    }

    public SourceGraphParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a workflow file.
     *
     * @param path path to the JSON document
     * @return parse result
     * @throws IOException if the file cannot be read or is not JSON
     * @throws StructuralException if the document is not a valid workflow
     */
    public ParseResult read(Path path) throws IOException {
        log.debug("Reading workflow from {}", path);
        return read(objectMapper.readTree(Files.readString(path)));
    }

    /**
     * Parses a workflow from JSON text.
     *
     * @param json JSON document
     * @return parse result
     * @throws StructuralException if the text is not JSON or not a valid workflow
     */
    public ParseResult read(String json) {
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new StructuralException("Workflow document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a workflow document tree.
     *
     * @param document root JSON node
     * @return parse result
     * @throws StructuralException if the document is not a valid workflow
     */
    public ParseResult read(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new StructuralException("Workflow document must be a JSON object");
        }
        JsonNode workflow = document.has("workflow") ? document.get("workflow") : document;
        if (!workflow.isObject()) {
            throw new StructuralException("'workflow' must be a JSON object");
        }

        String name = workflow.path("name").asText(null);
        List<SourceNode> nodes = parseNodes(workflow.path("nodes"));
        Map<String, String> aliases = aliases(workflow.path("nodes"), nodes);

        List<CompilationWarning> warnings = new ArrayList<>();
        List<SourceEdge> edges = parseEdges(workflow.path("edges"), aliases, warnings);

        String entryId = resolveEntry(nodes, edges);
        Set<String> orphans = findOrphans(nodes, edges, entryId);
        for (String orphan : orphans) {
            CompilationWarning warning = new CompilationWarning(WarningKind.ORPHAN_NODE, orphan,
                "Node has no incoming edge and is not the entry node; excluded with its edges");
            log.warn("{}", warning);
            warnings.add(warning);
        }

        List<SourceNode> included = nodes.stream().filter(n -> !orphans.contains(n.id())).toList();
        List<SourceEdge> includedEdges = edges.stream()
            .filter(e -> !orphans.contains(e.fromNodeId()) && !orphans.contains(e.toNodeId()))
            .toList();

        SourceGraph graph = new SourceGraph(name, included, includedEdges, entryId, orphans);
        log.info("Parsed workflow '{}': {} nodes, {} edges, entry '{}'",
            graph.name(), included.size(), includedEdges.size(), entryId);
        return new ParseResult(graph, warnings);
    }

    /**
     * Parses a workflow file, discarding warnings (they are still logged).
     *
     * @param path path to the JSON document
     * @return source graph
     * @throws IOException if the file cannot be read
     */
    public SourceGraph parse(Path path) throws IOException {
        return read(path).graph();
    }

    /**
     * Parses workflow JSON text, discarding warnings (they are still logged).
     *
     * @param json JSON document
     * @return source graph
     */
    public SourceGraph parse(String json) {
        return read(json).graph();
    }

    /**
     * Parses a workflow document tree, discarding warnings (they are still logged).
     *
     * @param document root JSON node
     * @return source graph
     */
    public SourceGraph parse(JsonNode document) {
        return read(document).graph();
    }

    private List<SourceNode> parseNodes(JsonNode nodesNode) {
        if (!nodesNode.isArray() || nodesNode.isEmpty()) {
            throw new StructuralException("Workflow has no nodes");
        }
        List<SourceNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode nodeJson : nodesNode) {
            SourceNode node = parseNode(nodeJson, index++);
            if (!seen.add(node.id())) {
                throw new StructuralException("Duplicate node id '" + node.id() + "'");
            }
            nodes.add(node);
        }

        long flagged = nodes.stream().filter(SourceNode::start).count();
        if (flagged > 1) {
            throw new StructuralException("More than one node is flagged isStart: " + nodes.stream()
                .filter(SourceNode::start).map(SourceNode::id).toList());
        }
        return nodes;
    }

    private SourceNode parseNode(JsonNode json, int index) {
        if (!json.isObject()) {
            throw new StructuralException("Node #" + index + " is not a JSON object");
        }
        String nodeName = text(json, "name");
        String id = text(json, "id");
        if (id == null) {
            id = nodeName;
        }
        if (id == null) {
            throw new StructuralException("Node #" + index + " has neither id nor name");
        }

        SideEffectKind sideEffect = SideEffectKind.NONE;
        String sideEffectLabel = null;
        if (TOOL_TYPE.equals(text(json, "type"))) {
            sideEffectLabel = json.path("tool").path("type").asText("unknown");
            sideEffect = TRANSFER_TOOL.equals(sideEffectLabel) ? SideEffectKind.TRANSFER : SideEffectKind.TERMINATE;
        }

        Position position = null;
        JsonNode positionJson = json.path("metadata").path("position");
        if (positionJson.isObject()) {
            position = new Position(positionJson.path("x").asDouble(0), positionJson.path("y").asDouble(0));
        }

        SourceNode node = new SourceNode(
            id,
            nodeName != null ? nodeName : id,
            json.path("prompt").asText(""),
            text(json.path("messagePlan"), "firstMessage"),
            parseExtraction(json.path("variableExtractionPlan").path("output"), id),
            sideEffect,
            sideEffectLabel,
            json.path("isStart").asBoolean(false),
            position
        );
        log.debug("Node '{}' ({} extraction fields, side effect {})",
            node.id(), node.extractionSchema().size(), node.sideEffectKind());
        return node;
    }

    private static List<ExtractionField> parseExtraction(JsonNode output, String nodeId) {
        List<ExtractionField> fields = new ArrayList<>();
        for (JsonNode var : output) {
            String title = text(var, "title");
            if (title == null) {
                log.debug("Skipping extraction entry without title in node '{}'", nodeId);
                continue;
            }
            List<String> enumValues = new ArrayList<>();
            var.path("enum").forEach(v -> enumValues.add(v.asText()));
            FieldKind kind = FieldKind.fromSchemaType(text(var, "type"), !enumValues.isEmpty());
            fields.add(new ExtractionField(title, kind, enumValues, var.path("description").asText("")));
        }
        return fields;
    }

    private static Map<String, String> aliases(JsonNode nodesNode, List<SourceNode> nodes) {
        Map<String, String> aliases = new HashMap<>();
        int i = 0;
        for (JsonNode nodeJson : nodesNode) {
            String nodeName = text(nodeJson, "name");
            if (nodeName != null) {
                aliases.putIfAbsent(nodeName, nodes.get(i).id());
            }
            i++;
        }
        // ids take precedence over names
        nodes.forEach(n -> aliases.put(n.id(), n.id()));
        return aliases;
    }

    private static List<SourceEdge> parseEdges(JsonNode edgesNode, Map<String, String> aliases,
                                               List<CompilationWarning> warnings) {
        List<SourceEdge> edges = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode edgeJson : edgesNode) {
            String from = text(edgeJson, "from");
            String to = text(edgeJson, "to");
            if (from == null || to == null) {
                throw new StructuralException("Edge #" + index + " is missing 'from' or 'to'");
            }
            String fromId = aliases.get(from);
            String toId = aliases.get(to);
            if (fromId == null) {
                throw new StructuralException("Edge #" + index + " (" + from + " -> " + to
                    + ") references unknown node '" + from + "'");
            }
            if (toId == null) {
                throw new StructuralException("Edge #" + index + " (" + from + " -> " + to
                    + ") references unknown node '" + to + "'");
            }
            index++;

            SourceEdge edge = new SourceEdge(fromId, toId, parseCondition(edgeJson.path("condition")));
            if (!seen.add(fromId + "\u0000" + toId)) {
                CompilationWarning warning = new CompilationWarning(WarningKind.DUPLICATE_EDGE, edge.toString(),
                    "Duplicate edge ignored; the first occurrence and its condition are kept");
                log.warn("{}", warning);
                warnings.add(warning);
                continue;
            }
            edges.add(edge);
        }
        return edges;
    }

    private static EdgeCondition parseCondition(JsonNode conditionJson) {
        if (!conditionJson.isObject()) {
            return null;
        }
        ConditionKind kind = CLASSIFIED_CONDITION_TYPE.equals(text(conditionJson, "type"))
            ? ConditionKind.CLASSIFIED
            : ConditionKind.STATIC;
        return new EdgeCondition(kind, conditionJson.path("prompt").asText(""));
    }

    private static String resolveEntry(List<SourceNode> nodes, List<SourceEdge> edges) {
        for (SourceNode node : nodes) {
            if (node.start()) {
                return node.id();
            }
        }
        List<String> roots = roots(nodes, edges);
        if (roots.isEmpty()) {
            throw new StructuralException("No entry node: every node has an incoming edge and none is flagged"
                + " isStart; flag the entry node \"isStart\": true");
        }
        if (roots.size() > 1) {
            throw new StructuralException("Ambiguous entry node: " + roots
                + " have no incoming edges and none is flagged isStart; flag one node \"isStart\": true"
                + " to choose the entry (the others are then excluded as orphans)");
        }
        return roots.get(0);
    }

    private static Set<String> findOrphans(List<SourceNode> nodes, List<SourceEdge> edges, String entryId) {
        Set<String> orphans = new LinkedHashSet<>(roots(nodes, edges));
        orphans.remove(entryId);
        return orphans;
    }

    private static List<String> roots(List<SourceNode> nodes, List<SourceEdge> edges) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        nodes.forEach(n -> inDegree.put(n.id(), 0));
        edges.forEach(e -> inDegree.merge(e.toNodeId(), 1, Integer::sum));
        return inDegree.entrySet().stream()
            .filter(e -> e.getValue() == 0)
            .map(Map.Entry::getKey)
            .toList();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.asText().isBlank() ? value.asText() : null;
    }
}
