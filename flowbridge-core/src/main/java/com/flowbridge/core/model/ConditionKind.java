package com.flowbridge.core.model;

/**
 * How a transition condition is evaluated in the source system.
 */
public enum ConditionKind {
    /** Deterministic condition (logic expression or unconditional) */
    STATIC,

    /** Natural-language condition judged by a language model */
    CLASSIFIED
}
