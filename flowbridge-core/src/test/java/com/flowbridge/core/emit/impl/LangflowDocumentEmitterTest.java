package com.flowbridge.core.emit.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.compiler.CompilationResult;
import com.flowbridge.core.emit.EmittedDocument;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.model.ComponentInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LangflowDocumentEmitter}.
 */
class LangflowDocumentEmitterTest extends FlowTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LangflowDocumentEmitter emitter = new LangflowDocumentEmitter();
    private CompilationResult result;
    private JsonNode document;

    @BeforeEach
    void setUp() throws Exception {
        result = compileFixture("appointment-booking.json");
        document = MAPPER.readTree(emitter.emit(result, EmitterConfig.defaults()).content());
    }

    @Test
    void emit_writesFlowHeader() {
        assertThat(document.path("name").asText()).isEqualTo("Appointment Booking");
        assertThat(document.path("id").asText()).isEqualTo(result.flowId());
        assertThat(document.path("description").asText())
            .isEqualTo("Converted from conversational workflow: Appointment Booking");
        assertThat(document.path("is_component").asBoolean()).isFalse();
        assertThat(document.path("data").path("viewport").path("zoom").asInt()).isEqualTo(1);
    }

    @Test
    void emit_nodesCarryInstanceIdentityAndPosition() {
        JsonNode nodes = document.path("data").path("nodes");
        assertThat(nodes).hasSize(result.graph().instances().size());

        ComponentInstance greeting = nodeInstance(result.graph(), "greeting");
        JsonNode node = findById(nodes, greeting.id());
        assertThat(node.path("data").path("id").asText()).isEqualTo(greeting.id());
        assertThat(node.path("data").path("node").path("display_name").asText()).isEqualTo("Greeting");
        assertThat(node.path("position").path("x").asDouble()).isEqualTo(greeting.position().x());
    }

    @Test
    void emit_edgesCarryEncodedAndStructuredHandles() throws Exception {
        JsonNode edges = document.path("data").path("edges");
        assertThat(edges).hasSize(result.graph().connections().size());

        for (JsonNode edge : edges) {
            JsonNode sourceHandle = MAPPER.readTree(edge.path("sourceHandle").asText());
            JsonNode targetHandle = MAPPER.readTree(edge.path("targetHandle").asText());
            assertThat(sourceHandle).isEqualTo(edge.path("data").path("sourceHandle"));
            assertThat(targetHandle).isEqualTo(edge.path("data").path("targetHandle"));
            assertThat(sourceHandle.path("id").asText()).isEqualTo(edge.path("source").asText());
            assertThat(targetHandle.path("id").asText()).isEqualTo(edge.path("target").asText());
            assertThat(edge.path("id").asText()).isEqualTo("xy-edge__" + edge.path("source").asText()
                + edge.path("sourceHandle").asText() + "-" + edge.path("target").asText()
                + edge.path("targetHandle").asText());
        }
    }

    @Test
    void emit_gateLegUsesPortNames() {
        String gateId = result.plans().get(0).gateInstanceIds().get(0);
        String bookId = nodeInstance(result.graph(), "book").id();

        JsonNode leg = findEdge(document.path("data").path("edges"), gateId, bookId);

        assertThat(leg.path("data").path("sourceHandle").path("name").asText()).isEqualTo("true_result");
        assertThat(leg.path("data").path("sourceHandle").path("dataType").asText()).isEqualTo("ConditionalRouter");
        assertThat(leg.path("data").path("targetHandle").path("fieldName").asText()).isEqualTo("input_value");
        assertThat(leg.path("data").has("condition")).isFalse();
    }

    @Test
    void emit_successorEdgeKeepsCondition() {
        JsonNode edge = findEdge(document.path("data").path("edges"),
            nodeInstance(result.graph(), "book").id(), nodeInstance(result.graph(), "confirm").id());

        assertThat(edge.path("data").path("condition").path("type").asText()).isEqualTo("classified");
        assertThat(edge.path("data").path("condition").path("prompt").asText()).isEqualTo("slot agreed");
    }

    @Test
    void emit_compactMode_writesSingleLine() {
        EmittedDocument compact = emitter.emit(result, new EmitterConfig(false, Map.of()));

        assertThat(compact.content()).doesNotContain("\n  ");
        assertThat(compact.name()).isEqualTo("pipeline");
        assertThat(compact.fileExtension()).isEqualTo("json");
    }

    private static JsonNode findById(JsonNode nodes, String id) {
        for (JsonNode node : nodes) {
            if (node.path("id").asText().equals(id)) {
                return node;
            }
        }
        throw new AssertionError("No node " + id);
    }

    private static JsonNode findEdge(JsonNode edges, String source, String target) {
        List<JsonNode> matches = new ArrayList<>();
        edges.forEach(e -> {
            if (e.path("source").asText().equals(source) && e.path("target").asText().equals(target)) {
                matches.add(e);
            }
        });
        assertThat(matches).hasSize(1);
        return matches.get(0);
    }
}
