package com.flowbridge.core.compiler;

import com.flowbridge.core.analysis.BranchAnalysis;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.RoutingPlan;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.TargetGraph;
import com.flowbridge.core.model.WarningKind;

import java.util.List;
import java.util.Objects;

/**
 * Everything a compilation produced.
 *
 * @param flowId id of the emitted flow document
 * @param mode compilation mode used
 * @param source parsed source graph
 * @param analysis branch-point analysis
 * @param plans routing plans, one per routed branch point
 * @param graph final target graph
 * @param warnings all warnings, in the order they were raised
 */
public record CompilationResult(
    String flowId,
    CompilationMode mode,
    SourceGraph source,
    BranchAnalysis analysis,
    List<RoutingPlan> plans,
    TargetGraph graph,
    List<CompilationWarning> warnings
) {
    public CompilationResult {
        Objects.requireNonNull(flowId, "flowId must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        plans = plans == null ? List.of() : List.copyOf(plans);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<CompilationWarning> warningsOf(WarningKind kind) {
        return warnings.stream().filter(w -> w.kind() == kind).toList();
    }

    /**
     * Returns the description written into the flow document.
     *
     * @return flow description
     */
    public String description() {
        return "Converted from conversational workflow: " + source.name();
    }
}
