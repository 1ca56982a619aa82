package com.flowbridge.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest extends CommandTestBase {

    @Test
    void list_components_printsBundledPalette() {
        int exitCode = run("list", "components");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Palette Components:")
            .contains("  • Chat Input (ID: EntryPoint)")
            .contains("    Runtime Type: ChatInput")
            .contains("    Runtime Type: ConditionalRouter")
            .contains("true_result");
    }

    @Test
    void list_emitters_printsAllEmitters() {
        int exitCode = run("list", "emitters");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Available Emitters:")
            .contains("(ID: langflow-json)", "(ID: markdown-report)", "(ID: mermaid)")
            .contains("    File Extension: .json");
    }

    @Test
    void list_renderers_printsConsoleAndFilesystem() {
        int exitCode = run("list", "renderers");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("  • console", "  • filesystem");
    }

    @Test
    void list_typeIsCaseInsensitive() {
        assertThat(run("list", "EMITTER")).isZero();
    }

    @Test
    void list_unknownType_returnsError() {
        int exitCode = run("list", "widgets");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Unknown type: widgets");
    }
}
