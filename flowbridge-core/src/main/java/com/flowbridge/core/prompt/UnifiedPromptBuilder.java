package com.flowbridge.core.prompt;

import com.flowbridge.core.model.ExtractionField;
import com.flowbridge.core.model.SourceEdge;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;

import java.util.List;

/**
 * Folds a whole workflow into one instruction text for a single agent.
 *
 * <p>Used by the unified compilation mode: instead of one component per node plus routing, a
 * single agent carries every node's instruction, extraction fields and transitions, and tracks
 * the current node itself.
 */
public class UnifiedPromptBuilder {

    /**
     * Builds the consolidated instruction text.
     *
     * @param graph parsed source graph
     * @return instruction text
     */
    public String build(SourceGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a unified conversational assistant for the workflow \"").append(graph.name())
            .append("\". Handle the entire conversation flow defined below.\n");
        sb.append("Follow the state transitions and instructions of each node exactly.\n");
        sb.append("Keep the persona and tone of the starting node throughout the conversation.\n");

        sb.append("\n--- GLOBAL INSTRUCTIONS ---\n");
        sb.append("1. State: you are always in exactly one node of the conversation. You start in node \"")
            .append(graph.entryNodeId()).append("\".\n");
        sb.append("2. Transitions: after each user reply, check the transitions of the current node and move ")
            .append("to the first node whose condition is met.\n");
        sb.append("3. Responses: speak only as the instruction of the current node directs.\n");
        sb.append("4. Extraction: if the current node lists variables to extract, output them as JSON at ")
            .append("the end of your reply.\n");

        sb.append("\n--- CONVERSATION FLOW ---\n");
        for (SourceNode node : graph.nodes()) {
            appendNode(sb, node, graph.outgoing(node.id()), node.id().equals(graph.entryNodeId()));
        }

        sb.append("\n--- RESPONSE FORMAT ---\n");
        sb.append("For every turn, your output must be:\n");
        sb.append("1. Your conversational reply.\n");
        sb.append("2. If the node extracts variables, a JSON object with the extracted values.\n");
        sb.append("3. A state marker: [State: <current node> -> <next node>]");
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, SourceNode node, List<SourceEdge> outgoing, boolean entry) {
        sb.append("\n## NODE: ").append(node.id()).append('\n');
        if (entry && node.hasFirstMessage()) {
            sb.append("STARTING MESSAGE: \"").append(node.firstMessage()).append("\"\n");
        }
        if (node.hasSideEffect()) {
            sb.append("ACTION: ").append(node.sideEffectLabel())
                .append(" (not executed by this agent; close the conversation politely)\n");
        }
        if (!node.instructionText().isBlank()) {
            sb.append("INSTRUCTION: ").append(node.instructionText()).append('\n');
        }
        if (!node.extractionSchema().isEmpty()) {
            sb.append("VARIABLES TO EXTRACT:\n");
            for (ExtractionField field : node.extractionSchema()) {
                sb.append("- ").append(field.fieldName()).append(" (").append(field.kind().schemaName()).append(')');
                if (!field.description().isBlank()) {
                    sb.append(": ").append(field.description());
                }
                if (field.hasEnumValues()) {
                    sb.append(" (Options: ").append(String.join(", ", field.enumValues())).append(')');
                }
                sb.append('\n');
            }
        }
        if (outgoing.isEmpty()) {
            sb.append("TRANSITIONS: End of conversation.\n");
            return;
        }
        sb.append("TRANSITIONS:\n");
        for (SourceEdge edge : outgoing) {
            String condition = edge.conditionText().isBlank() ? "always" : edge.conditionText();
            sb.append("- IF ").append(condition).append(" -> GOTO Node: ").append(edge.toNodeId()).append('\n');
        }
    }
}
