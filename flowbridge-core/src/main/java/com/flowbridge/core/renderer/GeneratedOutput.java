package com.flowbridge.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * The files produced by one compile run, in write order. The pipeline document comes first.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        if (files.isEmpty()) {
            throw new IllegalArgumentException("A compile run produces at least the pipeline document");
        }
        long distinct = files.stream().map(GeneratedFile::relativePath).distinct().count();
        if (distinct != files.size()) {
            throw new IllegalArgumentException("Generated files must have distinct paths: " + files.stream()
                .map(GeneratedFile::relativePath).toList());
        }
        files = List.copyOf(files);
    }

    /**
     * Returns the relative paths of all files, in write order.
     *
     * @return relative paths
     */
    public List<String> fileNames() {
        return files.stream().map(GeneratedFile::relativePath).toList();
    }
}
