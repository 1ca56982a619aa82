package com.flowbridge.core.renderer.impl;

import com.flowbridge.core.renderer.GeneratedFile;
import com.flowbridge.core.renderer.GeneratedOutput;
import com.flowbridge.core.renderer.OutputRenderer;
import com.flowbridge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;

/**
 * Writes the pipeline document and its companion files below the context's output directory.
 *
 * <p>Each file is written to a temporary sibling and moved into place, so a runtime importing
 * {@code <stem>_pipeline.json} never sees a half-written document. A file whose bytes are already
 * on disk is left untouched; recompiling with the same id seed therefore keeps timestamps stable.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    private static final String TEMP_SUFFIX = ".tmp";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Path.of(context.outputDirectory()).toAbsolutePath().normalize();
        logger.debug("Writing {} to {}", output.fileNames(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (GeneratedFile file : output.files()) {
            if (writeFile(outputDir, file)) {
                written++;
            }
        }
        logger.info("{} of {} file(s) written to {}", written, output.files().size(), outputDir);
    }

    /**
     * Writes one file.
     *
     * @return false if the file already held exactly this content
     */
    private boolean writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir) || target.equals(outputDir)) {
            throw new IllegalArgumentException("Generated file '" + file.relativePath()
                + "' resolves outside the output directory " + outputDir);
        }

        byte[] bytes = file.content().getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(target.getParent());
            if (Files.isRegularFile(target) && Arrays.equals(Files.readAllBytes(target), bytes)) {
                logger.debug("{} unchanged", target);
                return false;
            }

            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Wrote {} ({} bytes)", target, bytes.length);
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}
