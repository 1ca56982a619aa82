package com.flowbridge.core.compiler;

import com.flowbridge.core.analysis.BranchAnalysis;
import com.flowbridge.core.analysis.BranchPointAnalyzer;
import com.flowbridge.core.assembly.AssemblyResult;
import com.flowbridge.core.assembly.GraphAssembler;
import com.flowbridge.core.config.CompilerConfig;
import com.flowbridge.core.layout.LayoutPlanner;
import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.ComponentType;
import com.flowbridge.core.model.ConnectionKind;
import com.flowbridge.core.model.OverridableField;
import com.flowbridge.core.model.Position;
import com.flowbridge.core.model.RoutingPlan;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.model.SourceNode;
import com.flowbridge.core.model.WarningKind;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import com.flowbridge.core.palette.PaletteLoader;
import com.flowbridge.core.parser.ParseResult;
import com.flowbridge.core.prompt.PromptAugmenter;
import com.flowbridge.core.prompt.UnifiedPromptBuilder;
import com.flowbridge.core.routing.RoutingSynthesizer;
import com.flowbridge.core.util.InstanceIdGenerator;
import com.flowbridge.core.wiring.WireBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compiles a parsed workflow into a target graph.
 *
 * <p>Pipeline for {@link CompilationMode#ROUTED}:
 * <ol>
 *   <li>clone the entry sentinel, then one component per source node; conversational nodes get an
 *       augmented instruction text, tool nodes become exit-point placeholders</li>
 *   <li>analyze branch points</li>
 *   <li>synthesize a classifier and gate chain for every near branch point</li>
 *   <li>clone the exit sentinel</li>
 *   <li>wire successor edges, routing edges and finally sentinel edges</li>
 *   <li>prune unreachable instances and verify integrity</li>
 * </ol>
 *
 * <p>A compiler is stateless between calls: every {@link #compile} call starts a fresh id
 * sequence, so a seeded configuration reproduces identical output.
 */
public class FlowCompiler {

    private static final Logger log = LoggerFactory.getLogger(FlowCompiler.class);

    private final ComponentPaletteRegistry registry;
    private final CompilerConfig config;
    private final PromptAugmenter augmenter = new PromptAugmenter();
    private final UnifiedPromptBuilder unifiedPromptBuilder = new UnifiedPromptBuilder();
    private final LayoutPlanner layout = new LayoutPlanner();

    public FlowCompiler(ComponentPaletteRegistry registry, CompilerConfig config) {
        this.registry = registry;
        this.config = config != null ? config : CompilerConfig.defaults();
    }

    /**
     * Creates a compiler with the palette named by the configuration, or the bundled palette.
     *
     * @param config compiler configuration
     * @return compiler
     * @throws IOException if the palette cannot be read
     */
    public static FlowCompiler create(CompilerConfig config) throws IOException {
        CompilerConfig effective = config != null ? config : CompilerConfig.defaults();
        PaletteLoader loader = new PaletteLoader(effective.palette().placeholderMarkers());
        String directory = effective.palette().directory();
        ComponentPaletteRegistry registry = loader.load(directory != null ? Path.of(directory) : null);
        return new FlowCompiler(registry, effective);
    }

    public ComponentPaletteRegistry registry() {
        return registry;
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compiles in routed mode.
     *
     * @param parsed parser output
     * @return compilation result
     */
    public CompilationResult compile(ParseResult parsed) {
        return compile(parsed, CompilationMode.ROUTED);
    }

    /**
     * Compiles a parsed workflow.
     *
     * @param parsed parser output
     * @param mode compilation mode
     * @return compilation result
     * @throws com.flowbridge.core.error.PaletteLookupException if the palette lacks a needed type or port
     */
    public CompilationResult compile(ParseResult parsed, CompilationMode mode) {
        SourceGraph graph = parsed.graph();
        log.info("Compiling '{}' ({} mode, {} nodes)", graph.name(), mode.name().toLowerCase(Locale.ROOT), graph.nodes().size());

        InstanceIdGenerator ids = new InstanceIdGenerator(config.output().idSeed());
        List<CompilationWarning> warnings = new ArrayList<>(parsed.warnings());
        BranchAnalysis analysis = new BranchPointAnalyzer(config.routing().maxDepth()).analyze(graph);

        CompilationResult result = mode == CompilationMode.UNIFIED
            ? compileUnified(graph, analysis, ids, warnings)
            : compileRouted(graph, analysis, ids, warnings);

        log.info("Compiled '{}': {} components, {} connections, {} routed branch point(s), {} warning(s)",
            graph.name(), result.graph().instances().size(), result.graph().connections().size(),
            result.plans().size(), result.warnings().size());
        return result;
    }

    private CompilationResult compileRouted(SourceGraph graph, BranchAnalysis analysis, InstanceIdGenerator ids,
                                            List<CompilationWarning> warnings) {
        GraphAssembler assembler = new GraphAssembler(graph.name());
        ComponentInstance entry = sentinel(ComponentType.ENTRY_POINT, ids, layout.entryPosition());
        assembler.add(entry);

        Map<String, ComponentInstance> nodeInstances = new LinkedHashMap<>();
        List<SourceNode> nodes = graph.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            SourceNode node = nodes.get(i);
            ComponentInstance instance = nodeInstance(node, layout.nodePosition(node, i), ids, warnings);
            nodeInstances.put(node.id(), instance);
            assembler.add(instance);
        }

        warnings.addAll(analysis.warnings());

        RoutingSynthesizer synthesizer = new RoutingSynthesizer(registry, ids, config.routing(), layout);
        List<RoutingPlan> plans = new ArrayList<>();
        for (BranchPoint branchPoint : analysis.nearBranchPoints()) {
            Position position = nodeInstances.get(branchPoint.nodeId()).position();
            synthesizer.synthesize(branchPoint, graph, position).ifPresent(routing -> {
                plans.add(routing.plan());
                assembler.addAll(routing.instances());
                warnings.addAll(routing.warnings());
            });
        }

        ComponentInstance exit = sentinel(ComponentType.EXIT_POINT, ids,
            layout.exitPosition(assembler.instancesById().values()));
        assembler.add(exit);

        WireBuilder wires = new WireBuilder(registry);
        Map<String, ComponentInstance> instances = assembler.instancesById();
        assembler.connectAll(wires.successorConnections(graph, nodeInstances, plans));
        for (RoutingPlan plan : plans) {
            assembler.connectAll(wires.routingConnections(plan, instances, nodeInstances));
        }
        assembler.connectAll(wires.sentinelConnections(graph, nodeInstances, entry, exit));

        AssemblyResult assembled = assembler.assemble(entry.id(), exit.id());
        warnings.addAll(assembled.warnings());
        return new CompilationResult(ids.flowId(graph.name()), CompilationMode.ROUTED, graph, analysis, plans,
            assembled.graph(), warnings);
    }

    private CompilationResult compileUnified(SourceGraph graph, BranchAnalysis analysis, InstanceIdGenerator ids,
                                             List<CompilationWarning> warnings) {
        GraphAssembler assembler = new GraphAssembler(graph.name());
        ComponentInstance entry = sentinel(ComponentType.ENTRY_POINT, ids, layout.entryPosition());

        String agentType = registry.getBlueprint(ComponentType.CONVERSATION_AGENT).runtimeType();
        ComponentInstance agent = registry.clone(ComponentType.CONVERSATION_AGENT, ids.next(agentType));
        agent = registry.override(agent, OverridableField.INSTRUCTION, unifiedPromptBuilder.build(graph))
            .withDisplayName(graph.name())
            .withDescription("Unified agent for " + graph.nodes().size() + " workflow nodes")
            .withSourceNodeId(graph.entryNodeId())
            .withPosition(layout.nodePosition(graph.entryNode(), 0));

        ComponentInstance exit = sentinel(ComponentType.EXIT_POINT, ids, layout.exitPosition(List.of(entry, agent)));
        assembler.add(entry).add(agent).add(exit);

        WireBuilder wires = new WireBuilder(registry);
        assembler.connect(wires.connectPrimary(entry, agent, ConnectionKind.SENTINEL, null));
        assembler.connect(wires.connectPrimary(agent, exit, ConnectionKind.SENTINEL, null));

        AssemblyResult assembled = assembler.assemble(entry.id(), exit.id());
        warnings.addAll(assembled.warnings());
        return new CompilationResult(ids.flowId(graph.name()), CompilationMode.UNIFIED, graph, analysis, List.of(),
            assembled.graph(), warnings);
    }

    private ComponentInstance nodeInstance(SourceNode node, Position position, InstanceIdGenerator ids,
                                           List<CompilationWarning> warnings) {
        if (node.hasSideEffect()) {
            String runtimeType = registry.getBlueprint(ComponentType.EXIT_POINT).runtimeType();
            CompilationWarning warning = new CompilationWarning(WarningKind.DEGRADED_SIDE_EFFECT, node.id(),
                "Action '" + node.sideEffectLabel() + "' (" + node.sideEffectKind()
                    + ") is not executed; compiled to a terminal " + runtimeType + " placeholder");
            log.warn("{}", warning);
            warnings.add(warning);
            return registry.clone(ComponentType.EXIT_POINT, ids.next(runtimeType))
                .withDisplayName(node.displayName())
                .withDescription("Tool: " + node.sideEffectLabel())
                .withSourceNodeId(node.id())
                .withPosition(position);
        }

        String runtimeType = registry.getBlueprint(ComponentType.CONVERSATION_AGENT).runtimeType();
        ComponentInstance agent = registry.clone(ComponentType.CONVERSATION_AGENT, ids.next(runtimeType));
        log.debug("Node '{}' -> {}", node.id(), agent.id());
        return registry.override(agent, OverridableField.INSTRUCTION, augmenter.augment(node))
            .withDisplayName(node.displayName())
            .withSourceNodeId(node.id())
            .withPosition(position);
    }

    private ComponentInstance sentinel(ComponentType type, InstanceIdGenerator ids, Position position) {
        String runtimeType = registry.getBlueprint(type).runtimeType();
        return registry.clone(type, ids.next(runtimeType)).withPosition(position);
    }
}
