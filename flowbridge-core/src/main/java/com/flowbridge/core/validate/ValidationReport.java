package com.flowbridge.core.validate;

import java.util.List;

/**
 * Outcome of validating an emitted flow document.
 *
 * @param nodeCount number of nodes inspected
 * @param edgeCount number of edges inspected
 * @param problems one message per defect found, in document order
 */
public record ValidationReport(
    int nodeCount,
    int edgeCount,
    List<String> problems
) {
    public ValidationReport {
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public boolean isValid() {
        return problems.isEmpty();
    }
}
