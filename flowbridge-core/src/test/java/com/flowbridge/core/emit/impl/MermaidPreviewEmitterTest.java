package com.flowbridge.core.emit.impl;

import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.compiler.CompilationResult;
import com.flowbridge.core.emit.EmittedDocument;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.model.RoutingPlan;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MermaidPreviewEmitter}.
 */
class MermaidPreviewEmitterTest extends FlowTestBase {

    private final MermaidPreviewEmitter emitter = new MermaidPreviewEmitter();

    @Test
    void emit_wrapsFlowchartInMarkdown() {
        EmittedDocument document = emitter.emit(compileFixture("orphan-node.json"), EmitterConfig.defaults());

        assertThat(document.name()).isEqualTo("preview");
        assertThat(document.content()).startsWith("# Survey (flow preview)\n\n```mermaid\ngraph LR\n");
        assertThat(document.content()).endsWith("```\n");
    }

    @Test
    void emit_shapesFollowComponentType() {
        CompilationResult result = compileFixture("appointment-booking.json");
        RoutingPlan plan = result.plans().get(0);

        String content = emitter.emit(result, EmitterConfig.defaults()).content();

        assertThat(content).contains(sanitize(result.graph().entryInstanceId()) + "([\"Chat Input\"])");
        assertThat(content).contains(sanitize(plan.classifierInstanceId()) + "{{\"Router (Greeting)\"}}");
        assertThat(content).contains(sanitize(plan.gateInstanceIds().get(0)) + "{\"Route Check (Book Appointment)\"}");
        assertThat(content).contains(sanitize(nodeInstance(result.graph(), "book").id()) + "[\"Book Appointment\"]");
    }

    @Test
    void emit_labelsGateLegsAndConditions() {
        CompilationResult result = compileFixture("appointment-booking.json");
        String gate = sanitize(result.plans().get(0).gateInstanceIds().get(0));
        String book = sanitize(nodeInstance(result.graph(), "book").id());
        String confirm = sanitize(nodeInstance(result.graph(), "confirm").id());

        String content = emitter.emit(result, EmitterConfig.defaults()).content();

        assertThat(content).contains(gate + " -.-> |\"true_result\"| " + book);
        assertThat(content).contains(book + " --> |\"slot agreed\"| " + confirm);
    }

    private static String sanitize(String id) {
        return id.replace('-', '_');
    }
}
