package com.flowbridge.core.routing;

import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.RoutingPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output of routing synthesis for one branch point.
 *
 * @param plan routing plan consumed by the wire builder
 * @param classifier classifier instance
 * @param gates gate instances in chain order
 * @param warnings condition warnings raised for this branch point
 */
public record RoutingResult(
    RoutingPlan plan,
    ComponentInstance classifier,
    List<ComponentInstance> gates,
    List<CompilationWarning> warnings
) {
    public RoutingResult {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        gates = gates == null ? List.of() : List.copyOf(gates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns the classifier followed by the gates.
     *
     * @return all synthesized instances
     */
    public List<ComponentInstance> instances() {
        List<ComponentInstance> all = new ArrayList<>();
        all.add(classifier);
        all.addAll(gates);
        return all;
    }
}
