package com.flowbridge.core.model;

/**
 * Kinds of non-fatal compilation findings.
 */
public enum WarningKind {
    /** Source node without incoming transitions, excluded from compilation */
    ORPHAN_NODE,

    /** Component unreachable from the entry, pruned before emission */
    ORPHAN_INSTANCE,

    /** Deep branch point compiled as unguarded fan-out */
    UNROUTED_BRANCH,

    /** Branch conditions that cannot be told apart; unmatched replies take the default path */
    ROUTING_AMBIGUITY,

    /** Routed transition without a condition description */
    MISSING_CONDITION,

    /** Side-effecting node compiled to a terminal placeholder */
    DEGRADED_SIDE_EFFECT,

    /** Repeated transition between the same two nodes, ignored */
    DUPLICATE_EDGE
}
