package com.flowbridge.core.emit.impl;

import com.flowbridge.core.FlowTestBase;
import com.flowbridge.core.compiler.CompilationMode;
import com.flowbridge.core.config.CompilerConfig;
import com.flowbridge.core.emit.EmitterConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkdownReportEmitter}.
 */
class MarkdownReportEmitterTest extends FlowTestBase {

    private final MarkdownReportEmitter emitter = new MarkdownReportEmitter();

    @Test
    void emit_routedWorkflow_listsPlanAndWarnings() {
        String report = emitter.emit(compileFixture("appointment-booking.json"), EmitterConfig.defaults()).content();

        assertThat(report).startsWith("# Compilation Report: Appointment Booking\n\n## Summary\n");
        assertThat(report).contains("| Mode | routed |", "| Components | 11 |", "| Gates | 2 |");
        assertThat(report).contains("### greeting");
        assertThat(report).contains("| 1 | wants new appointment |");
        assertThat(report).contains("| false_result | Clinic Info |");
        assertThat(report).contains("## Unrouted Branch Points\n\n_None._");
        assertThat(report).contains("| DEGRADED_SIDE_EFFECT | hangup |");
    }

    @Test
    void emit_deepBranch_explainsFanOutTradeOff() {
        String report = emitter.emit(compileFixture("deep-branch.json"), EmitterConfig.defaults()).content();

        assertThat(report).contains("## Routed Branch Points\n\n_None._");
        assertThat(report).contains("may still run");
        assertThat(report).contains("| triage | 2 | 2 |");
    }

    @Test
    void emit_unifiedMode_hasNoUnroutedBranches() {
        String report = emitter.emit(compile(fixture("deep-branch.json"),
            CompilerConfig.defaults().withIdSeed(SEED), CompilationMode.UNIFIED), EmitterConfig.defaults()).content();

        assertThat(report).contains("| Mode | unified |");
        assertThat(report).contains("## Unrouted Branch Points\n\n_None._");
    }

    @Test
    void emit_escapesPipesInConditions() {
        String json = """
            {"name": "Pipes", "nodes": [{"id": "a"}, {"id": "b"}, {"id": "c"}],
             "edges": [{"from": "a", "to": "b", "condition": {"type": "ai", "prompt": "yes | sure"}},
                       {"from": "a", "to": "c", "condition": {"type": "ai", "prompt": "no"}}]}
            """;

        String report = emitter.emit(compile(json), EmitterConfig.defaults()).content();

        assertThat(report).contains("yes \\| sure");
    }
}
