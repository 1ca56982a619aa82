package com.flowbridge.core.emit.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowbridge.core.compiler.CompilationResult;
import com.flowbridge.core.emit.EmittedDocument;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.emit.TargetEmitter;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.Connection;
import com.flowbridge.core.model.PortSpec;
import com.flowbridge.core.model.TargetGraph;
import com.flowbridge.core.palette.ComponentPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Emits the flow document the target runtime imports.
 *
 * <p>Nodes are the cloned payloads with identity, display name, description and position written
 * in. Each edge carries both handles twice: JSON-encoded as strings in {@code sourceHandle} and
 * {@code targetHandle}, and as objects under {@code data}:
 * <pre>{@code
 * sourceHandle: {"dataType": "Agent", "id": "Agent-1a2b3", "name": "response", "output_types": ["Message"]}
 * targetHandle: {"fieldName": "input_text", "id": "ConditionalRouter-9f8e7", "inputTypes": ["Message"], "type": "str"}
 * id:           "xy-edge__" + source + sourceHandle + "-" + target + targetHandle
 * }</pre>
 * Successor edges that came from a conditional source edge also carry {@code data.condition}.
 */
public class LangflowDocumentEmitter implements TargetEmitter {

    private static final Logger log = LoggerFactory.getLogger(LangflowDocumentEmitter.class);

    private static final String EMITTER_ID = "langflow-json";
    private static final String DISPLAY_NAME = "Langflow Flow Document";
    private static final String FILE_EXTENSION = "json";
    private static final String EDGE_ID_PREFIX = "xy-edge__";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getId() {
        return EMITTER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public EmittedDocument emit(CompilationResult result, EmitterConfig config) {
        ObjectNode document = toDocument(result);
        try {
            String content = config.pretty()
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                : objectMapper.writeValueAsString(document);
            log.debug("Emitted flow document: {} nodes, {} edges", document.path("data").path("nodes").size(),
                document.path("data").path("edges").size());
            return new EmittedDocument("pipeline", content, FILE_EXTENSION);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flow document", e);
        }
    }

    /**
     * Builds the flow document tree.
     *
     * @param result compilation result
     * @return flow document
     */
    public ObjectNode toDocument(CompilationResult result) {
        TargetGraph graph = result.graph();
        ObjectNode document = objectMapper.createObjectNode();
        document.put("name", graph.name());
        document.put("description", result.description());
        document.put("id", result.flowId());
        document.putNull("icon");
        document.putNull("icon_bg_color");
        document.putNull("gradient");
        document.put("is_component", false);

        ObjectNode data = document.putObject("data");
        ArrayNode nodes = data.putArray("nodes");
        graph.instances().forEach(instance -> nodes.add(node(instance)));

        Map<String, ComponentInstance> byId = new HashMap<>();
        graph.instances().forEach(i -> byId.put(i.id(), i));
        ArrayNode edges = data.putArray("edges");
        for (Connection connection : graph.connections()) {
            edges.add(edge(connection, byId.get(connection.sourceInstanceId())));
        }

        ObjectNode viewport = data.putObject("viewport");
        viewport.put("x", 0);
        viewport.put("y", 0);
        viewport.put("zoom", 1);
        return document;
    }

    private static ObjectNode node(ComponentInstance instance) {
        ObjectNode node = instance.payload().deepCopy();
        ComponentPayload.stamp(node, instance.id(), instance.displayName(), instance.description());
        ComponentPayload.place(node, instance.position().x(), instance.position().y());
        return node;
    }

    private ObjectNode edge(Connection connection, ComponentInstance source) {
        PortSpec out = connection.sourceOutputPort();
        PortSpec in = connection.targetInputPort();

        ObjectNode sourceHandle = objectMapper.createObjectNode();
        sourceHandle.put("dataType", source.runtimeType());
        sourceHandle.put("id", connection.sourceInstanceId());
        sourceHandle.put("name", out.name());
        ArrayNode outputTypes = sourceHandle.putArray("output_types");
        out.dataKinds().forEach(outputTypes::add);

        ObjectNode targetHandle = objectMapper.createObjectNode();
        targetHandle.put("fieldName", in.name());
        targetHandle.put("id", connection.targetInstanceId());
        ArrayNode inputTypes = targetHandle.putArray("inputTypes");
        in.dataKinds().forEach(inputTypes::add);
        targetHandle.put("type", in.fieldType());

        String sourceHandleText = encode(sourceHandle);
        String targetHandleText = encode(targetHandle);

        ObjectNode edge = objectMapper.createObjectNode();
        edge.put("source", connection.sourceInstanceId());
        edge.put("sourceHandle", sourceHandleText);
        edge.put("target", connection.targetInstanceId());
        edge.put("targetHandle", targetHandleText);
        ObjectNode data = edge.putObject("data");
        data.set("targetHandle", targetHandle);
        data.set("sourceHandle", sourceHandle);
        if (connection.condition() != null) {
            ObjectNode condition = data.putObject("condition");
            condition.put("type", connection.condition().kind().name().toLowerCase(Locale.ROOT));
            condition.put("prompt", connection.condition().description());
        }
        edge.put("id", EDGE_ID_PREFIX + connection.sourceInstanceId() + sourceHandleText
            + "-" + connection.targetInstanceId() + targetHandleText);
        edge.put("selected", false);
        edge.put("animated", false);
        edge.put("className", "");
        return edge;
    }

    private String encode(ObjectNode handle) {
        try {
            return objectMapper.writeValueAsString(handle);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode edge handle " + handle, e);
        }
    }
}
