package com.flowbridge.core.assembly;

import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.ConnectionKind;
import com.flowbridge.core.model.TargetGraph;
import com.flowbridge.core.wiring.WireBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GraphAssembler}.
 */
class GraphAssemblerTest extends FlowTestBase {

    private ComponentInstance entry;
    private ComponentInstance agent;
    private ComponentInstance exit;
    private WireBuilder wires;

    @BeforeEach
    void setUp() {
        entry = registry().clone(ComponentType.ENTRY_POINT, "in");
        agent = registry().clone(ComponentType.CONVERSATION_AGENT, "agent");
        exit = registry().clone(ComponentType.EXIT_POINT, "out");
        wires = new WireBuilder(registry());
    }

    @Test
    void assemble_validGraph_keepsInsertionOrder() {
        AssemblyResult result = new GraphAssembler("Flow")
            .add(entry).add(agent).add(exit)
            .connect(wires.connectPrimary(entry, agent, ConnectionKind.SENTINEL, null))
            .connect(wires.connectPrimary(agent, exit, ConnectionKind.SENTINEL, null))
            .assemble("in", "out");

        TargetGraph graph = result.graph();
        assertThat(graph.name()).isEqualTo("Flow");
        assertThat(graph.instances()).extracting(ComponentInstance::id).containsExactly("in", "agent", "out");
        assertThat(graph.outgoing("in")).hasSize(1);
        assertThat(graph.incoming("out")).hasSize(1);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void assemble_duplicateId_throwsException() {
        GraphAssembler assembler = new GraphAssembler("Flow").addAll(List.of(entry, agent, agent, exit));

        assertThatThrownBy(() -> assembler.assemble("in", "out"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Duplicate instance id 'agent'");
    }

    @Test
    void assemble_missingExit_throwsException() {
        GraphAssembler assembler = new GraphAssembler("Flow").add(entry).add(agent);

        assertThatThrownBy(() -> assembler.assemble("in", "out"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Exit instance 'out' is missing");
    }

    @Test
    void assemble_danglingConnection_throwsException() {
        ComponentInstance ghost = registry().clone(ComponentType.CONVERSATION_AGENT, "ghost");
        GraphAssembler assembler = new GraphAssembler("Flow").add(entry).add(exit)
            .connect(wires.connectPrimary(entry, ghost, ConnectionKind.SENTINEL, null));

        assertThatThrownBy(() -> assembler.assemble("in", "out"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("references a missing instance");
    }

    @Test
    void instancesById_returnsLatestInsertions() {
        GraphAssembler assembler = new GraphAssembler("Flow").add(entry).add(agent);

        assertThat(assembler.instancesById()).containsOnlyKeys("in", "agent");
    }
}
