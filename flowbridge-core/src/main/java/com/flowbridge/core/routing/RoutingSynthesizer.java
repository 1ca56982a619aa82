package com.flowbridge.core.routing;

import com.flowbridge.core.config.CompilerConfig.RoutingSettings;
import com.flowbridge.core.layout.LayoutPlanner;
import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.OverridableField;
import com.flowbridge.core.model.PortRole;
import com.flowbridge.core.model.Position;
import com.flowbridge.core.model.RoutedEdge;
import com.flowbridge.core.model.RoutingPlan;
import com.flowbridge.core.model.SourceEdge;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;
import com.flowbridge.core.model.WarningKind;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import com.flowbridge.core.util.InstanceIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the classifier and gate chain that selects exactly one successor of a branch point.
 *
 * <p>For successors S1..SN the synthesizer creates:
 * <ul>
 *   <li>one classifier, cloned from the ConversationAgent blueprint, told to answer with only the
 *       number of the matching condition</li>
 *   <li>N - 1 gates; gate k tests the classifier reply for the digit k, sends Sk out of its match
 *       port and hands everything else to gate k + 1 through its no-match port</li>
 *   <li>SN hangs off the last gate's no-match port and also absorbs replies no gate matched</li>
 * </ul>
 *
 * <p>Each branch point is synthesized at most once per synthesizer.
 */
public class RoutingSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(RoutingSynthesizer.class);

    /** Above this many successors "contains" would confuse "1" with "10". */
    static final int MAX_SINGLE_DIGIT_BRANCHES = 9;
    static final String EXACT_OPERATOR = "equals";
    static final String CASE_SENSITIVE_FIELD = "case_sensitive";

    private final ComponentPaletteRegistry registry;
    private final InstanceIdGenerator idGenerator;
    private final RoutingSettings settings;
    private final LayoutPlanner layout;
    private final Set<String> synthesized = new HashSet<>();
    private Map<String, Object> gateParameters;

    public RoutingSynthesizer(ComponentPaletteRegistry registry, InstanceIdGenerator idGenerator,
                              RoutingSettings settings, LayoutPlanner layout) {
        this.registry = registry;
        this.idGenerator = idGenerator;
        this.settings = settings;
        this.layout = layout;
    }

    /**
     * Synthesizes routing for a near branch point.
     *
     * @param branchPoint branch point to route
     * @param graph source graph, for successor names
     * @param branchPosition editor position of the branch point's component
     * @return routing result, or empty if this branch point was already synthesized
     * @throws IllegalArgumentException if the branch point is deep or has fewer than two successors
     */
    public Optional<RoutingResult> synthesize(BranchPoint branchPoint, SourceGraph graph, Position branchPosition) {
        if (!branchPoint.isNear()) {
            throw new IllegalArgumentException("Branch point '" + branchPoint.nodeId() + "' is not routed");
        }
        List<SourceEdge> edges = branchPoint.outgoing();
        if (edges.size() < 2) {
            throw new IllegalArgumentException("Branch point '" + branchPoint.nodeId() + "' has "
                + edges.size() + " successor(s)");
        }
        if (!synthesized.add(branchPoint.nodeId())) {
            log.debug("Routing for '{}' already synthesized, skipping", branchPoint.nodeId());
            return Optional.empty();
        }

        List<CompilationWarning> warnings = new ArrayList<>();
        List<String> conditions = conditionTexts(branchPoint, warnings);
        int branches = edges.size();
        String branchName = graph.node(branchPoint.nodeId()).map(SourceNode::displayName).orElse(branchPoint.nodeId());

        ComponentInstance classifier = buildClassifier(branchName, conditions, branchPosition);

        String operator = settings.operator();
        if (branches > MAX_SINGLE_DIGIT_BRANCHES && !EXACT_OPERATOR.equals(operator)) {
            log.debug("Branch point '{}' has {} successors, gates compare with '{}'",
                branchPoint.nodeId(), branches, EXACT_OPERATOR);
            operator = EXACT_OPERATOR;
        }

        String matchPort = registry.outputForRole(ComponentType.BINARY_GATE, PortRole.MATCH).name();
        String noMatchPort = registry.outputForRole(ComponentType.BINARY_GATE, PortRole.NO_MATCH).name();

        List<ComponentInstance> gates = new ArrayList<>();
        List<RoutedEdge> routed = new ArrayList<>();
        for (int k = 1; k < branches; k++) {
            SourceEdge edge = edges.get(k - 1);
            String successorName = graph.node(edge.toNodeId()).map(SourceNode::displayName).orElse(edge.toNodeId());
            ComponentInstance gate = buildGate(k, operator, successorName, layout.gatePosition(branchPosition, k));
            gates.add(gate);
            routed.add(new RoutedEdge(edge, gate.id(), matchPort));
        }
        ComponentInstance lastGate = gates.get(gates.size() - 1);
        routed.add(new RoutedEdge(edges.get(branches - 1), lastGate.id(), noMatchPort));

        RoutingPlan plan = new RoutingPlan(branchPoint.nodeId(), classifier.id(),
            gates.stream().map(ComponentInstance::id).toList(), routed);
        log.info("Routed '{}': classifier {} and {} gate(s) for {} successors",
            branchPoint.nodeId(), classifier.id(), gates.size(), branches);
        return Optional.of(new RoutingResult(plan, classifier, gates, warnings));
    }

    /**
     * Builds the classifier instruction text.
     *
     * @param conditions condition descriptions in successor order
     * @return instruction text
     */
    public String classifierInstruction(List<String> conditions) {
        int n = conditions.size();
        StringBuilder sb = new StringBuilder();
        sb.append("You are a routing classifier for a conversation workflow. Based on the user's latest ")
            .append("message and the conversation so far, decide which condition best matches the user's intent.\n\n");
        sb.append("CONDITIONS:\n");
        for (int i = 0; i < n; i++) {
            sb.append(i + 1).append(". ").append(conditions.get(i)).append('\n');
        }
        sb.append("\nINSTRUCTIONS:\n");
        sb.append("- Choose the number (1 to ").append(n).append(") of the condition that best matches.\n");
        sb.append("- If several conditions apply, choose the most specific one.\n");
        sb.append("- Respond with ONLY the number, nothing else: no words, no punctuation, no explanation.\n\n");
        sb.append("CORRECT response: 1\n");
        sb.append("INCORRECT responses: \"Condition 1\", \"1.\", \"The answer is 1\", \"I think it is 1\"\n\n");
        sb.append("Your response (just the number):");
        return sb.toString();
    }

    private List<String> conditionTexts(BranchPoint branchPoint, List<CompilationWarning> warnings) {
        List<String> conditions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<SourceEdge> edges = branchPoint.outgoing();
        for (int i = 0; i < edges.size(); i++) {
            SourceEdge edge = edges.get(i);
            String text = edge.conditionText().trim();
            if (text.isEmpty()) {
                text = "Condition " + (i + 1);
                warn(warnings, WarningKind.MISSING_CONDITION, edge.toString(),
                    "Edge has no condition description; the classifier sees '" + text + "'");
            }
            if (!seen.add(text.toLowerCase(Locale.ROOT))) {
                warn(warnings, WarningKind.ROUTING_AMBIGUITY, edge.toString(),
                    "Condition '" + text + "' repeats under branch point '" + branchPoint.nodeId()
                        + "'; the classifier cannot tell these successors apart");
            }
            conditions.add(text);
        }
        return conditions;
    }

    private ComponentInstance buildClassifier(String branchName, List<String> conditions, Position branchPosition) {
        String runtimeType = registry.getBlueprint(ComponentType.CLASSIFIER).runtimeType();
        ComponentInstance classifier = registry.clone(ComponentType.CLASSIFIER, idGenerator.next(runtimeType));
        classifier = registry.override(classifier, OverridableField.INSTRUCTION, classifierInstruction(conditions));
        return classifier
            .withDisplayName("Router (" + branchName + ")")
            .withDescription("Selects one of " + conditions.size() + " paths after " + branchName)
            .withPosition(layout.classifierPosition(branchPosition));
    }

    private ComponentInstance buildGate(int index, String operator, String successorName, Position position) {
        ComponentBlueprint blueprint = registry.getBlueprint(ComponentType.BINARY_GATE);
        ComponentInstance gate = registry.clone(ComponentType.BINARY_GATE, idGenerator.next(blueprint.runtimeType()));
        for (Map.Entry<String, Object> parameter : gateParameters(blueprint).entrySet()) {
            gate = registry.setParameter(gate, parameter.getKey(), parameter.getValue());
        }
        gate = registry.setParameter(gate, CASE_SENSITIVE_FIELD, settings.caseSensitive());
        if (blueprint.boundField(OverridableField.OPERATOR).isPresent()) {
            gate = registry.override(gate, OverridableField.OPERATOR, operator);
        }
        // applied last: the gate chain depends on gate k testing exactly "k"
        gate = registry.override(gate, OverridableField.MATCH_TEXT, String.valueOf(index));
        return gate
            .withDisplayName("Route Check (" + successorName + ")")
            .withDescription("Matches classifier reply " + index)
            .withPosition(position);
    }

    /**
     * Returns the configured gate parameters minus the fields the compiler owns: bound fields,
     * required fields and the case-sensitivity flag. Dropped keys are logged once.
     */
    private Map<String, Object> gateParameters(ComponentBlueprint blueprint) {
        if (gateParameters != null) {
            return gateParameters;
        }
        Set<String> owned = new HashSet<>(blueprint.requiredFields().keySet());
        owned.add(CASE_SENSITIVE_FIELD);
        for (OverridableField field : OverridableField.values()) {
            blueprint.boundField(field).ifPresent(owned::add);
        }

        Map<String, Object> accepted = new LinkedHashMap<>();
        settings.gateParameters().forEach((name, value) -> {
            if (owned.contains(name)) {
                log.warn("Ignoring gate parameter '{}': {} sets this field itself", name, blueprint.runtimeType());
            } else {
                accepted.put(name, value);
            }
        });
        gateParameters = Collections.unmodifiableMap(accepted);
        return gateParameters;
    }

    private static void warn(List<CompilationWarning> warnings, WarningKind kind, String subject, String message) {
        CompilationWarning warning = new CompilationWarning(kind, subject, message);
        log.warn("{}", warning);
        warnings.add(warning);
    }
}
