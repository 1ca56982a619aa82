package com.flowbridge.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed palette of target component types the compiler knows how to use.
 */
public enum ComponentType {
    /** Pipeline ingress sentinel where user input enters the graph */
    ENTRY_POINT("EntryPoint"),

    /** Language-model agent driving one conversational node */
    CONVERSATION_AGENT("ConversationAgent"),

    /** Agent that maps the conversation to a single routing digit */
    CLASSIFIER("Classifier"),

    /** Two-output component forwarding its input to exactly one output */
    BINARY_GATE("BinaryGate"),

    /** Pipeline egress sentinel */
    EXIT_POINT("ExitPoint");

    private final String documentName;

    ComponentType(String documentName) {
        this.documentName = documentName;
    }

    /**
     * Returns the name used for this type in palette documents.
     *
     * @return document name (e.g. "BinaryGate")
     */
    public String documentName() {
        return documentName;
    }

    /**
     * Returns the type whose blueprint instances of this type are cloned from.
     *
     * <p>Classifiers are cloned from the conversation agent blueprint: a gate's input
     * validator needs the full structured reply an agent produces, which a bare
     * text-completion component does not emit.
     *
     * @return blueprint source type
     */
    public ComponentType blueprintSource() {
        return this == CLASSIFIER ? CONVERSATION_AGENT : this;
    }

    /**
     * Resolves a palette document name.
     *
     * @param name document name (case-insensitive), or the enum constant name
     * @return matching type, or empty if unknown
     */
    public static Optional<ComponentType> fromDocumentName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(t -> t.documentName.equalsIgnoreCase(name) || t.name().equalsIgnoreCase(name))
            .findFirst();
    }
}
