package com.flowbridge.core.renderer.impl;

import com.flowbridge.core.renderer.GeneratedFile;
import com.flowbridge.core.renderer.RendererTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest extends RendererTestBase {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withHeadersDisabled_printsOnlyContent() {
        // Given
        GeneratedFile file = new GeneratedFile("survey_pipeline.json", "{\"name\":\"Survey\"}", "application/json");

        // When
        renderer.render(output(file), context(Map.of("console.showHeaders", "false")));

        // Then
        assertThat(printed()).isEqualTo("{\"name\":\"Survey\"}" + System.lineSeparator());
    }

    @Test
    void render_withMultipleFiles_printsHeadersAndSeparator() {
        // Given
        GeneratedFile pipeline = new GeneratedFile("survey_pipeline.json", "{}", "application/json");
        GeneratedFile preview = new GeneratedFile("survey_preview.md", "graph LR", "text/markdown");

        // When
        renderer.render(output(pipeline, preview), context(Map.of()));

        // Then
        String printed = printed();
        assertThat(printed).contains("File 1/2: survey_pipeline.json", "Type: application/json");
        assertThat(printed).contains("File 2/2: survey_preview.md", "Type: text/markdown");
        assertThat(printed).contains("-".repeat(78));
        assertThat(printed.indexOf("graph LR")).isGreaterThan(printed.indexOf("{}"));
    }

    @Test
    void render_withColors_usesAnsiCodes() {
        // Given
        GeneratedFile file = new GeneratedFile("a.md", "text", "text/markdown");

        // When
        renderer.render(output(file), context(Map.of("console.colors", "true")));

        // Then
        assertThat(printed()).contains("\u001B[36m", "\u001B[0m");
    }

    @Test
    void render_withCustomSeparator_usesIt() {
        // When
        renderer.render(output(new GeneratedFile("a.md", "A", null), new GeneratedFile("b.md", "B", null)),
            context(Map.of("console.separator", "=")));

        // Then
        assertThat(printed()).contains("=".repeat(80)).doesNotContain("Type:");
    }

    private String printed() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }
}
