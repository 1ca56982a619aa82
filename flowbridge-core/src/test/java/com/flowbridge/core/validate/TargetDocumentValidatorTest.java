package com.flowbridge.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.emit.impl.LangflowDocumentEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TargetDocumentValidator}.
 */
class TargetDocumentValidatorTest extends FlowTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TargetDocumentValidator validator;
    private ObjectNode document;

    @BeforeEach
    void setUp() throws Exception {
        validator = new TargetDocumentValidator(registry(), loader());
        String json = new LangflowDocumentEmitter()
            .emit(compileFixture("appointment-booking.json"), EmitterConfig.defaults()).content();
        document = (ObjectNode) MAPPER.readTree(json);
    }

    @Test
    void validate_compiledDocument_isValid() {
        ValidationReport report = validator.validate(document);

        assertThat(report.problems()).isEmpty();
        assertThat(report.isValid()).isTrue();
        assertThat(report.nodeCount()).isEqualTo(11);
        assertThat(report.edgeCount()).isEqualTo(11);
    }

    @Test
    void validate_invalidJson_reportsSingleProblem() {
        ValidationReport report = validator.validate("{not json");

        assertThat(report.problems()).singleElement().asString().startsWith("Document is not valid JSON");
    }

    @Test
    void validate_missingArrays_reportsBoth() {
        ValidationReport report = validator.validate(MAPPER.createObjectNode());

        assertThat(report.problems()).containsExactly(
            "data.nodes is missing or not an array", "data.edges is missing or not an array");
    }

    @Test
    void validate_blankRequiredField_isReported() {
        ObjectNode firstAgent = firstNodeOfType("Agent");
        ((ObjectNode) firstAgent.path("data").path("node").path("template").path("model_name")).put("value", "");

        ValidationReport report = validator.validate(document);

        assertThat(report.isValid()).isFalse();
        assertThat(report.problems()).anySatisfy(p ->
            assertThat(p).contains("required field 'model_name'").contains("blank"));
    }

    @Test
    void validate_unknownRuntimeType_isReported() {
        ((ObjectNode) firstNodeOfType("ChatInput").path("data")).put("type", "TextInput");

        assertThat(validator.validate(document).problems()).anySatisfy(p ->
            assertThat(p).contains("runtime type 'TextInput'"));
    }

    @Test
    void validate_undeclaredPort_isReported() {
        ObjectNode edge = (ObjectNode) document.path("data").path("edges").get(0);
        ObjectNode handle = (ObjectNode) edge.path("data").path("sourceHandle").deepCopy();
        handle.put("name", "text_output");
        edge.put("sourceHandle", handle.toString());

        assertThat(validator.validate(document).problems()).anySatisfy(p ->
            assertThat(p).contains("has no output port 'text_output'"));
    }

    @Test
    void validate_handleNotEncoded_isReported() {
        ObjectNode edge = (ObjectNode) document.path("data").path("edges").get(0);
        JsonNode structured = edge.path("data").path("targetHandle").deepCopy();
        edge.set("targetHandle", structured);

        assertThat(validator.validate(document).problems()).anySatisfy(p ->
            assertThat(p).contains("targetHandle is not an encoded string"));
    }

    @Test
    void validate_danglingEdgeAndDuplicateNode_areReported() {
        ArrayNode nodes = (ArrayNode) document.path("data").path("nodes");
        JsonNode copy = nodes.get(0).deepCopy();
        nodes.add(copy);
        ((ObjectNode) document.path("data").path("edges").get(0)).put("target", "Missing-00000");

        assertThat(validator.validate(document).problems())
            .anySatisfy(p -> assertThat(p).startsWith("Duplicate node id"))
            .anySatisfy(p -> assertThat(p).endsWith("unknown target node"));
    }

    private ObjectNode firstNodeOfType(String runtimeType) {
        for (JsonNode node : document.path("data").path("nodes")) {
            if (runtimeType.equals(node.path("data").path("type").asText())) {
                return (ObjectNode) node;
            }
        }
        throw new AssertionError("No node of type " + runtimeType);
    }
}
