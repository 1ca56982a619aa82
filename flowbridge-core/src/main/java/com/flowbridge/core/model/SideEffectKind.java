package com.flowbridge.core.model;

/**
 * Externally-triggered actions a source node may perform.
 *
 * <p>The target runtime has no native equivalent for either side effect; nodes carrying
 * one are compiled to terminal placeholder components.
 */
public enum SideEffectKind {
    /** Plain conversational node */
    NONE,

    /** Ends the call */
    TERMINATE,

    /** Transfers the call to another party */
    TRANSFER
}
