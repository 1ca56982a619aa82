package com.flowbridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A dialogue state of the source conversational workflow.
 *
 * <p>Created by the parser and never modified during compilation.
 *
 * @param id unique node identifier (transitions refer to it)
 * @param displayName human-readable node name
 * @param instructionText prompt that drives the node's agent
 * @param firstMessage optional literal opening line, null if absent
 * @param extractionSchema ordered fields the node must extract
 * @param sideEffectKind side effect the node performs
 * @param sideEffectLabel raw side-effect type from the source (e.g. "transferCall"), null if none
 * @param start whether the node is flagged as the conversation start
 * @param position editor position from the source document, null for auto-layout
 */
public record SourceNode(
    String id,
    String displayName,
    String instructionText,
    String firstMessage,
    List<ExtractionField> extractionSchema,
    SideEffectKind sideEffectKind,
    String sideEffectLabel,
    boolean start,
    Position position
) {
    /**
     * Compact constructor with validation.
     */
    public SourceNode {
        Objects.requireNonNull(id, "id must not be null");
        if (displayName == null) {
            displayName = id;
        }
        if (instructionText == null) {
            instructionText = "";
        }
        extractionSchema = extractionSchema == null ? List.of() : List.copyOf(extractionSchema);
        if (sideEffectKind == null) {
            sideEffectKind = SideEffectKind.NONE;
        }
    }

    /**
     * Creates a plain conversational node.
     *
     * @param id node identifier
     * @param instructionText agent prompt
     * @return node without first message, schema or side effect
     */
    public static SourceNode conversation(String id, String instructionText) {
        return new SourceNode(id, id, instructionText, null, List.of(), SideEffectKind.NONE, null, false, null);
    }

    /**
     * Returns whether the node declares an opening line.
     *
     * @return true if a non-blank first message is present
     */
    public boolean hasFirstMessage() {
        return firstMessage != null && !firstMessage.isBlank();
    }

    /**
     * Returns whether the node performs an external side effect.
     *
     * @return true unless {@link SideEffectKind#NONE}
     */
    public boolean hasSideEffect() {
        return sideEffectKind != SideEffectKind.NONE;
    }
}
