package com.flowbridge.core.emit.impl;

import com.flowbridge.core.compiler.CompilationMode;
import com.flowbridge.core.compiler.CompilationResult;
import com.flowbridge.core.emit.EmittedDocument;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.emit.TargetEmitter;
import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.RoutedEdge;
import com.flowbridge.core.model.RoutingPlan;
import com.flowbridge.core.model.TargetGraph;

import java.util.List;
import java.util.Locale;

/**
 * Emits an operator report for a compilation.
 *
 * <p>Sections: summary counts, routed branch points with their gate legs, deep branch points
 * left as fan-out, and all warnings.
 */
public class MarkdownReportEmitter implements TargetEmitter {

    private static final String EMITTER_ID = "markdown-report";
    private static final String DISPLAY_NAME = "Compilation Report";
    private static final String FILE_EXTENSION = "md";

    private static final String TABLE_ROW_END = " |\n";
    private static final String NONE = "_None._\n";

    @Override
    public String getId() {
        return EMITTER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public EmittedDocument emit(CompilationResult result, EmitterConfig config) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Compilation Report: ").append(escapeMarkdown(result.source().name())).append("\n\n");
        appendSummary(sb, result);
        appendRoutingPlans(sb, result);
        appendDeepBranches(sb, result);
        appendWarnings(sb, result.warnings());
        return new EmittedDocument("report", sb.toString(), FILE_EXTENSION);
    }

    private static void appendSummary(StringBuilder sb, CompilationResult result) {
        TargetGraph graph = result.graph();
        sb.append("## Summary\n\n");
        sb.append("| Metric | Value |\n|--------|-------|\n");
        row(sb, "Mode", result.mode().name().toLowerCase(Locale.ROOT));
        row(sb, "Source nodes", String.valueOf(result.source().nodes().size()));
        row(sb, "Source edges", String.valueOf(result.source().edges().size()));
        row(sb, "Entry node", escapeMarkdown(result.source().entryNodeId()));
        row(sb, "Excluded orphan nodes", String.valueOf(result.source().orphanNodeIds().size()));
        row(sb, "Components", String.valueOf(graph.instances().size()));
        row(sb, "Connections", String.valueOf(graph.connections().size()));
        row(sb, "Classifiers", String.valueOf(graph.instancesOfType(ComponentType.CLASSIFIER).size()));
        row(sb, "Gates", String.valueOf(graph.instancesOfType(ComponentType.BINARY_GATE).size()));
        row(sb, "Routing depth", String.valueOf(result.analysis().maxRoutingDepth()));
        row(sb, "Warnings", String.valueOf(result.warnings().size()));
        sb.append('\n');
    }

    private static void appendRoutingPlans(StringBuilder sb, CompilationResult result) {
        sb.append("## Routed Branch Points\n\n");
        if (result.plans().isEmpty()) {
            sb.append(NONE).append('\n');
            return;
        }
        for (RoutingPlan plan : result.plans()) {
            sb.append("### ").append(escapeMarkdown(plan.branchPointNodeId())).append("\n\n");
            sb.append("Classifier: `").append(plan.classifierInstanceId()).append("`, ")
                .append(plan.gateInstanceIds().size()).append(" gate(s)\n\n");
            sb.append("| # | Condition | Gate | Port | Successor |\n");
            sb.append("|---|-----------|------|------|-----------|\n");
            List<RoutedEdge> legs = plan.routedEdges();
            for (int i = 0; i < legs.size(); i++) {
                RoutedEdge leg = legs.get(i);
                sb.append("| ").append(i + 1)
                    .append(" | ").append(escapeMarkdown(leg.edge().conditionText()))
                    .append(" | `").append(leg.gateInstanceId()).append('`')
                    .append(" | ").append(leg.outputPort())
                    .append(" | ").append(escapeMarkdown(successorName(result, leg.edge().toNodeId())))
                    .append(TABLE_ROW_END);
            }
            sb.append('\n');
        }
    }

    private static void appendDeepBranches(StringBuilder sb, CompilationResult result) {
        sb.append("## Unrouted Branch Points\n\n");
        List<BranchPoint> deep = result.analysis().deepBranchPoints();
        if (deep.isEmpty() || result.mode() == CompilationMode.UNIFIED) {
            sb.append(NONE).append('\n');
            return;
        }
        sb.append("These branch points sit deeper than routing depth ").append(result.analysis().maxRoutingDepth())
            .append(" and are wired as plain fan-out. The runtime forwards data along every wired ")
            .append("connection, so agents on paths the conversation did not take may still run.\n\n");
        sb.append("| Node | Depth | Successors |\n|------|-------|------------|\n");
        for (BranchPoint branchPoint : deep) {
            sb.append("| ").append(escapeMarkdown(branchPoint.nodeId()))
                .append(" | ").append(branchPoint.depth())
                .append(" | ").append(branchPoint.outgoing().size())
                .append(TABLE_ROW_END);
        }
        sb.append('\n');
    }

    private static void appendWarnings(StringBuilder sb, List<CompilationWarning> warnings) {
        sb.append("## Warnings\n\n");
        if (warnings.isEmpty()) {
            sb.append(NONE);
            return;
        }
        sb.append("| Kind | Subject | Message |\n|------|---------|---------|\n");
        for (CompilationWarning warning : warnings) {
            sb.append("| ").append(warning.kind())
                .append(" | ").append(escapeMarkdown(warning.subject()))
                .append(" | ").append(escapeMarkdown(warning.message()))
                .append(TABLE_ROW_END);
        }
    }

    private static String successorName(CompilationResult result, String nodeId) {
        return result.graph().instanceForNode(nodeId).map(ComponentInstance::displayName).orElse(nodeId);
    }

    private static void row(StringBuilder sb, String metric, String value) {
        sb.append("| ").append(metric).append(" | ").append(value).append(TABLE_ROW_END);
    }

    private static String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
