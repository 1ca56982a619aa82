package com.flowbridge.core.renderer.impl;

import com.flowbridge.core.renderer.GeneratedFile;
import com.flowbridge.core.renderer.RenderContext;
import com.flowbridge.core.renderer.RendererTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest extends RendererTestBase {

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleFiles_writesAllFiles() throws IOException {
        // Given
        GeneratedFile pipeline = new GeneratedFile("booking_pipeline.json", "{\"data\":{}}", "application/json");
        GeneratedFile report = new GeneratedFile("booking_report.md", "# Report", "text/markdown");

        // When
        renderer.render(output(pipeline, report), context(Map.of()));

        // Then
        assertThat(readFile("booking_pipeline.json")).isEqualTo("{\"data\":{}}");
        assertThat(readFile("booking_report.md")).isEqualTo("# Report");
    }

    @Test
    void render_withMissingOutputDirectory_createsIt() throws IOException {
        // Given
        String nested = tempDir.resolve("out/flows").toString();
        GeneratedFile file = new GeneratedFile("survey_pipeline.json", "{}", "application/json");

        // When
        renderer.render(output(file), new RenderContext(nested, Map.of()));

        // Then
        assertThat(tempDir.resolve("out/flows/survey_pipeline.json")).exists();
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("flow.json"), "old");

        // When
        renderer.render(output(new GeneratedFile("flow.json", "new", "application/json")), context(Map.of()));

        // Then
        assertThat(readFile("flow.json")).isEqualTo("new");
    }

    @Test
    void render_sameContentTwice_leavesFileUntouched() throws IOException {
        // Given
        GeneratedFile file = new GeneratedFile("flow.json", "{\"id\":\"seeded\"}", "application/json");
        renderer.render(output(file), context(Map.of()));
        FileTime past = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(tempDir.resolve("flow.json"), past);

        // When
        renderer.render(output(file), context(Map.of()));

        // Then
        assertThat(Files.getLastModifiedTime(tempDir.resolve("flow.json"))).isEqualTo(past);
    }

    @Test
    void render_leavesNoTemporaryFilesBehind() throws IOException {
        // When
        renderer.render(output(new GeneratedFile("flow.json", "{}", null), new GeneratedFile("flow.md", "#", null)),
            context(Map.of()));

        // Then
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(f -> f.getFileName().toString())).containsExactlyInAnyOrder("flow.json", "flow.md");
        }
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsException() {
        Path outputDir = tempDir.resolve("out");
        RenderContext context = RenderContext.of(outputDir, Map.of());

        assertThatThrownBy(() -> renderer.render(output(new GeneratedFile("../flow.json", "{}", null)), context))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("outside the output directory");
        assertThat(tempDir.resolve("flow.json")).doesNotExist();
    }

    @Test
    void render_outputDirectoryIsAFile_throwsException() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("blocked"), "x");
        RenderContext context = new RenderContext(tempDir.resolve("blocked").toString(), Map.of());

        // When / Then
        assertThatThrownBy(() -> renderer.render(output(new GeneratedFile("a.json", "{}", null)), context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }
}
