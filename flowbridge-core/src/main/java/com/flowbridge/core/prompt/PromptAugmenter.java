package com.flowbridge.core.prompt;

import com.flowbridge.core.model.ExtractionField;
import com.flowbridge.core.model.SourceNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Rewrites a conversational node's instruction text for a runtime that only sees the text.
 *
 * <p>Two directives are added, both plain text:
 * <ul>
 *   <li>a first-message directive in front, when the node declares a first message</li>
 *   <li>an extraction directive at the end, when the node declares an extraction schema</li>
 * </ul>
 * A node with neither comes back unchanged.
 */
public class PromptAugmenter {

    static final String FIRST_TURN_PREFIX = "When this is the first turn, open with exactly this text: ";
    static final String ROLE_HANDOVER = "Then proceed with the following role:";

    /**
     * Returns the augmented instruction text for a node.
     *
     * @param node source node
     * @return instruction text with directives applied
     */
    public String augment(SourceNode node) {
        String text = node.instructionText();
        if (node.hasFirstMessage()) {
            text = firstMessageDirective(node.firstMessage()) + "\n\n" + ROLE_HANDOVER + "\n" + text;
        }
        if (!node.extractionSchema().isEmpty()) {
            text = text + "\n\n" + extractionDirective(node.extractionSchema());
        }
        return text;
    }

    /**
     * Builds the directive telling the agent how to open the conversation.
     *
     * @param firstMessage exact opening text
     * @return directive line
     */
    public String firstMessageDirective(String firstMessage) {
        return FIRST_TURN_PREFIX + "\"" + firstMessage + "\"";
    }

    /**
     * Builds the directive asking for a structured object after the reply.
     *
     * @param schema extraction fields, in order
     * @return directive block
     */
    public String extractionDirective(List<ExtractionField> schema) {
        StringBuilder sb = new StringBuilder();
        sb.append("IMPORTANT: Produce your conversational reply first. Then, on a new line, output ONLY ")
            .append("a single JSON object with exactly these keys:\n");
        sb.append("{\n");
        for (int i = 0; i < schema.size(); i++) {
            ExtractionField field = schema.get(i);
            sb.append("  \"").append(field.fieldName()).append("\": ");
            String comment;
            if (field.hasEnumValues()) {
                sb.append('"').append(field.enumValues().get(0)).append('"');
                comment = "Options: " + String.join(", ", field.enumValues());
            } else {
                sb.append("\"<").append(field.kind().schemaName()).append(">\"");
                comment = field.description();
            }
            if (i < schema.size() - 1) {
                sb.append(',');
            }
            if (!comment.isBlank()) {
                sb.append(" // ").append(comment);
            }
            sb.append('\n');
        }
        sb.append("}\n");
        sb.append("Keys: ").append(schema.stream().map(ExtractionField::fieldName).collect(Collectors.joining(", ")));
        return sb.toString();
    }
}
