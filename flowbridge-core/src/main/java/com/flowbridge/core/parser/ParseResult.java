package com.flowbridge.core.parser;

import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.SourceGraph;

import java.util.List;
import java.util.Objects;

/**
 * Parsed source graph plus the warnings raised while reading it.
 *
 * @param graph validated source graph, orphans excluded
 * @param warnings orphan and duplicate-edge warnings, in discovery order
 */
public record ParseResult(
    SourceGraph graph,
    List<CompilationWarning> warnings
) {
    public ParseResult {
        Objects.requireNonNull(graph, "graph must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
