package com.flowbridge.core.assembly;

import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.TargetGraph;

import java.util.List;
import java.util.Objects;

/**
 * Pruned, integrity-checked target graph plus the pruning warnings.
 *
 * @param graph final target graph
 * @param warnings one warning per pruned instance
 */
public record AssemblyResult(
    TargetGraph graph,
    List<CompilationWarning> warnings
) {
    public AssemblyResult {
        Objects.requireNonNull(graph, "graph must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
