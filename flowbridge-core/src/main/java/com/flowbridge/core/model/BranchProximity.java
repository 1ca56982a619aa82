package com.flowbridge.core.model;

/**
 * Classification of a branch point by its distance from the entry node.
 */
public enum BranchProximity {
    /** Within the routing depth: gets a classifier and gate chain */
    NEAR,

    /** Beyond the routing depth: compiled as unguarded fan-out */
    DEEP
}
