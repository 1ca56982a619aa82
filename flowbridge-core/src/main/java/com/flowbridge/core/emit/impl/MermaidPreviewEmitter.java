package com.flowbridge.core.emit.impl;

import com.flowbridge.core.compiler.CompilationResult;
import com.flowbridge.core.emit.EmittedDocument;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.emit.TargetEmitter;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.Connection;
import com.flowbridge.core.model.ConnectionKind;
import com.flowbridge.core.model.TargetGraph;

/**
 * Emits a Mermaid flowchart of the compiled graph, embedded in Markdown.
 *
 * <p>Shapes follow the component type: sentinels are stadiums, agents rectangles, classifiers
 * hexagons and gates rhombi. Gate legs are labelled with the gate's output port, routing
 * connections are dotted.
 */
public class MermaidPreviewEmitter implements TargetEmitter {

    private static final String EMITTER_ID = "mermaid";
    private static final String DISPLAY_NAME = "Mermaid Flow Preview";
    private static final String FILE_EXTENSION = "md";

    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_LR = "graph LR\n";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

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
        TargetGraph graph = result.graph();
        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(escape(graph.name())).append(" (flow preview)\n\n");
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_LR);
        for (ComponentInstance instance : graph.instances()) {
            appendNode(sb, instance);
        }
        for (Connection connection : graph.connections()) {
            appendEdge(sb, connection);
        }
        sb.append(CODE_BLOCK_END);
        return new EmittedDocument("preview", sb.toString(), FILE_EXTENSION);
    }

    private static void appendNode(StringBuilder sb, ComponentInstance instance) {
        String id = sanitizeId(instance.id());
        String label = escape(instance.displayName());
        sb.append("  ").append(id);
        switch (instance.componentType()) {
            case ENTRY_POINT, EXIT_POINT -> sb.append("([\"").append(label).append("\"])");
            case CLASSIFIER -> sb.append("{{\"").append(label).append("\"}}");
            case BINARY_GATE -> sb.append("{\"").append(label).append("\"}");
            default -> sb.append("[\"").append(label).append("\"]");
        }
        sb.append('\n');
    }

    private static void appendEdge(StringBuilder sb, Connection connection) {
        String source = sanitizeId(connection.sourceInstanceId());
        String target = sanitizeId(connection.targetInstanceId());
        String arrow = connection.kind() == ConnectionKind.ROUTING ? " -.-> " : " --> ";
        sb.append("  ").append(source).append(arrow);
        String label = switch (connection.sourceOutputPort().role()) {
            case MATCH, NO_MATCH -> connection.sourceOutputPort().name();
            default -> connection.condition() != null && connection.condition().hasDescription()
                ? connection.condition().description()
                : null;
        };
        if (label != null) {
            sb.append("|\"").append(escape(label)).append("\"| ");
        }
        sb.append(target).append('\n');
    }

    private static String sanitizeId(String id) {
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
