package com.flowbridge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("flowbridge.yaml");
        Files.writeString(configFile, """
            routing:
              maxDepth: 2
              operator: equals
              caseSensitive: true
              gateParameters:
                max_iterations: 5

            palette:
              directory: "./palette"
              placeholderMarkers:
                - CHANGE_ME

            output:
              idSeed: 7
              pretty: false
              report: true
              diagram: true
            """);

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config.routing().maxDepth()).isEqualTo(2);
        assertThat(config.routing().operator()).isEqualTo("equals");
        assertThat(config.routing().caseSensitive()).isTrue();
        assertThat(config.routing().gateParameters()).containsExactly(Map.entry("max_iterations", 5));
        assertThat(config.palette().directory()).isEqualTo("./palette");
        assertThat(config.palette().placeholderMarkers()).containsExactly("CHANGE_ME");
        assertThat(config.output().idSeed()).isEqualTo(7L);
        assertThat(config.output().pretty()).isFalse();
        assertThat(config.output().report()).isTrue();
        assertThat(config.output().diagram()).isTrue();
    }

    @Test
    void load_partialYaml_fillsMissingValuesWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowbridge.yaml");
        Files.writeString(configFile, """
            routing:
              maxDepth: 3
            """);

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config.routing().maxDepth()).isEqualTo(3);
        assertThat(config.routing().operator()).isEqualTo(CompilerConfig.DEFAULT_OPERATOR);
        assertThat(config.routing().caseSensitive()).isFalse();
        assertThat(config.routing().gateParameters()).isEqualTo(CompilerConfig.DEFAULT_GATE_PARAMETERS);
        assertThat(config.palette().directory()).isNull();
        assertThat(config.palette().placeholderMarkers()).containsExactly(CompilerConfig.DEFAULT_PLACEHOLDER_MARKER);
        assertThat(config.output().idSeed()).isNull();
        assertThat(config.output().pretty()).isTrue();
    }

    @Test
    void load_blankOperator_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowbridge.yaml");
        Files.writeString(configFile, """
            routing:
              maxDepth: 2
              operator: ""
            """);

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("flowbridge.yaml");
        Files.writeString(configFile, """
            telemetry:
              enabled: true
            routing:
              maxDepth: 0
              shadowMode: true
            """);

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config.routing().maxDepth()).isZero();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        CompilerConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(CompilerConfig.defaults());
        assertThat(config.routing().maxDepth()).isEqualTo(CompilerConfig.DEFAULT_MAX_ROUTING_DEPTH);
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowbridge.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowbridge.yaml");
        Files.writeString(configFile, "");

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void withOverrides_replaceOnlyTheirValue() {
        CompilerConfig config = CompilerConfig.defaults()
            .withIdSeed(99L)
            .withMaxRoutingDepth(4)
            .withPaletteDirectory("custom");

        assertThat(config.output().idSeed()).isEqualTo(99L);
        assertThat(config.routing().maxDepth()).isEqualTo(4);
        assertThat(config.routing().operator()).isEqualTo(CompilerConfig.DEFAULT_OPERATOR);
        assertThat(config.palette().directory()).isEqualTo("custom");
        assertThat(config.palette().placeholderMarkers()).containsExactly(CompilerConfig.DEFAULT_PLACEHOLDER_MARKER);
    }
}
