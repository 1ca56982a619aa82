package com.flowbridge.core.model;

/**
 * Origin of a connection in the target graph.
 */
public enum ConnectionKind {
    /** 1:1 translation of a source transition */
    SUCCESSOR,

    /** Synthesized classifier/gate wiring for a branch point */
    ROUTING,

    /** Entry or exit sentinel wiring */
    SENTINEL
}
