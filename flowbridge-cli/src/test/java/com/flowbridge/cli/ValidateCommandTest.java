package com.flowbridge.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestBase {

    @Test
    void validate_bookingWorkflow_reportsBranchPoints() throws Exception {
        // Given
        Path source = writeWorkflow("booking.json", BOOKING_WORKFLOW);

        // When
        int exitCode = run("validate", source.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("✓ Palette provides [ENTRY_POINT, CONVERSATION_AGENT")
            .contains("✓ Workflow 'Booking': 4 nodes, 3 edges")
            .contains("  Entry node: greet")
            .contains("  • greet (depth 0, 2 successors): routed")
            .contains("✓ Workflow is valid");
    }

    @Test
    void validate_zeroDepth_stillRoutesEntryBranchPoint() throws Exception {
        Path source = writeWorkflow("booking.json", BOOKING_WORKFLOW);

        int exitCode = run("validate", source.toString(), "--max-routing-depth", "0");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("  • greet (depth 0, 2 successors): routed");
    }

    @Test
    void validate_linearWorkflowWithOrphan_listsExclusion() throws Exception {
        // Given
        Path source = writeWorkflow("linear.json", """
            {
              "workflow": {
                "name": "Linear",
                "nodes": [
                  {"id": "start", "isStart": true},
                  {"id": "end"},
                  {"id": "stray"}
                ],
                "edges": [
                  {"from": "start", "to": "end"},
                  {"from": "stray", "to": "end"}
                ]
              }
            }
            """);

        // When
        int exitCode = run("validate", source.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("✓ Workflow 'Linear': 2 nodes, 1 edges")
            .contains("  Excluded orphans: stray")
            .contains("  No branch points")
            .contains("  ! ORPHAN_NODE [stray]");
    }

    @Test
    void validate_ambiguousEntry_returnsError() throws Exception {
        // Given
        Path source = writeWorkflow("ambiguous.json", """
            {"nodes": [{"id": "a"}, {"id": "b"}], "edges": []}
            """);

        // When
        int exitCode = run("validate", source.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Validation failed: Ambiguous entry node", "flag one node \"isStart\": true");
    }

    @Test
    void validate_invalidJson_returnsError() throws Exception {
        Path source = writeWorkflow("broken.json", "{ not json");

        assertThat(run("validate", source.toString())).isEqualTo(1);
        assertThat(stderr()).contains("✗ Validation failed");
    }
}
