package com.flowbridge.core.palette;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.error.PaletteLookupException;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.OverridableField;
import com.flowbridge.core.model.PortRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentPaletteRegistry}.
 */
class ComponentPaletteRegistryTest extends FlowTestBase {

    @Test
    void clone_copiesBlueprintPayloadAndStampsIdentity() {
        ComponentInstance agent = registry().clone(ComponentType.CONVERSATION_AGENT, "Agent-00001");

        assertThat(agent.id()).isEqualTo("Agent-00001");
        assertThat(agent.runtimeType()).isEqualTo("Agent");
        assertThat(agent.payload().path("id").asText()).isEqualTo("Agent-00001");
        assertThat(agent.payload().path("data").path("id").asText()).isEqualTo("Agent-00001");
        assertThat(ComponentPayload.fieldValue(agent.payload(), "model_name"))
            .hasValueSatisfying(v -> assertThat(v.asText()).isEqualTo("gpt-4o-mini"));
    }

    @Test
    void clone_isIndependentOfBlueprintAndOtherClones() {
        ComponentInstance first = registry().clone(ComponentType.CONVERSATION_AGENT, "Agent-00001");
        ComponentInstance second = registry().clone(ComponentType.CONVERSATION_AGENT, "Agent-00002");

        ComponentPayload.setFieldValue(first.payload(), "model_name",
            first.payload().textNode("changed"));

        ObjectNode blueprintPayload = registry().getBlueprint(ComponentType.CONVERSATION_AGENT).payload();
        assertThat(ComponentPayload.fieldValue(second.payload(), "model_name").orElseThrow().asText())
            .isEqualTo("gpt-4o-mini");
        assertThat(ComponentPayload.fieldValue(blueprintPayload, "model_name").orElseThrow().asText())
            .isEqualTo("gpt-4o-mini");
    }

    @Test
    void clone_classifier_usesAgentBlueprintButKeepsItsType() {
        ComponentInstance classifier = registry().clone(ComponentType.CLASSIFIER, "Agent-00003");

        assertThat(classifier.componentType()).isEqualTo(ComponentType.CLASSIFIER);
        assertThat(classifier.runtimeType()).isEqualTo("Agent");
        assertThat(registry().findOutput(ComponentType.CLASSIFIER, "response")).isPresent();
    }

    @Test
    void override_rewritesOnlyTheBoundField() {
        ComponentInstance gate = registry().clone(ComponentType.BINARY_GATE, "ConditionalRouter-00001");

        ComponentInstance overridden = registry().override(gate, OverridableField.MATCH_TEXT, "2");

        assertThat(ComponentPayload.fieldValue(overridden.payload(), "match_text").orElseThrow().asText())
            .isEqualTo("2");
        assertThat(ComponentPayload.fieldValue(gate.payload(), "match_text").orElseThrow().asText())
            .isNotEqualTo("2");
        assertThat(ComponentPayload.fieldValue(overridden.payload(), "code"))
            .isEqualTo(ComponentPayload.fieldValue(gate.payload(), "code"));
    }

    @Test
    void override_unboundField_throwsException() {
        ComponentInstance entry = registry().clone(ComponentType.ENTRY_POINT, "ChatInput-00001");

        assertThatThrownBy(() -> registry().override(entry, OverridableField.INSTRUCTION, "hello"))
            .isInstanceOf(PaletteLookupException.class)
            .hasMessageContaining("instruction");
    }

    @Test
    void setParameter_fieldMissingFromTemplate_isSkipped() {
        ComponentInstance agent = registry().clone(ComponentType.CONVERSATION_AGENT, "Agent-00004");

        ComponentInstance unchanged = registry().setParameter(agent, "default_route", "false_result");

        assertThat(unchanged).isSameAs(agent);
    }

    @Test
    void setParameter_writesTypedValue() {
        ComponentInstance gate = registry().clone(ComponentType.BINARY_GATE, "ConditionalRouter-00002");

        ComponentInstance updated = registry().setParameter(gate, "max_iterations", 25);

        assertThat(ComponentPayload.fieldValue(updated.payload(), "max_iterations").orElseThrow().asInt())
            .isEqualTo(25);
    }

    @Test
    void portLookups_resolveByNameAndRole() {
        assertThat(registry().findInput(ComponentType.BINARY_GATE, "input_text")).isPresent();
        assertThat(registry().findInput(ComponentType.BINARY_GATE, "no_such_port")).isEmpty();
        assertThat(registry().outputForRole(ComponentType.BINARY_GATE, PortRole.MATCH).name())
            .isEqualTo("true_result");
        assertThat(registry().inputForRole(ComponentType.EXIT_POINT, PortRole.PRIMARY).dataKinds())
            .contains("Message");
    }

    @Test
    void outputForRole_missingRole_throwsException() {
        assertThatThrownBy(() -> registry().outputForRole(ComponentType.EXIT_POINT, PortRole.PRIMARY))
            .isInstanceOf(PaletteLookupException.class)
            .hasMessageContaining("ChatOutput");
    }

    @Test
    void getBlueprint_typeMissingFromPalette_namesTheType() {
        ComponentBlueprint entry = registry().getBlueprint(ComponentType.ENTRY_POINT);
        ComponentPaletteRegistry partial = new ComponentPaletteRegistry(List.of(entry));

        assertThatThrownBy(() -> partial.getBlueprint(ComponentType.CLASSIFIER))
            .isInstanceOf(PaletteLookupException.class)
            .hasMessageContaining("ConversationAgent")
            .hasMessageContaining("Classifier");
    }

    @Test
    void constructor_duplicateType_throwsException() {
        ComponentBlueprint entry = registry().getBlueprint(ComponentType.ENTRY_POINT);

        assertThatThrownBy(() -> new ComponentPaletteRegistry(List.of(entry, entry)))
            .isInstanceOf(PaletteLookupException.class)
            .hasMessageContaining("twice");
    }

    @Test
    void constructor_gateWithoutNoMatchPort_throwsException() {
        ComponentBlueprint gate = registry().getBlueprint(ComponentType.BINARY_GATE);
        ComponentBlueprint broken = new ComponentBlueprint(gate.componentType(), gate.runtimeType(),
            gate.displayName(), gate.requiredFields(), gate.fieldBindings(), gate.inputPorts(),
            gate.outputPorts().subList(0, 1), gate.payload());

        assertThatThrownBy(() -> new ComponentPaletteRegistry(List.of(broken)))
            .isInstanceOf(PaletteLookupException.class)
            .hasMessageContaining("NO_MATCH");
    }

    @Test
    void requiredFieldProblems_reportsClearedField() {
        ComponentInstance agent = registry().clone(ComponentType.CONVERSATION_AGENT, "Agent-00005");
        assertThat(registry().requiredFieldProblems(agent, loader())).isEmpty();

        ComponentPayload.setFieldValue(agent.payload(), "model_name", agent.payload().textNode(""));

        assertThat(registry().requiredFieldProblems(agent, loader()))
            .containsExactly("Agent-00005.model_name: value is blank");
    }
}
