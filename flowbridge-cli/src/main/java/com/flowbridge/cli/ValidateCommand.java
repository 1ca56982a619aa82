package com.flowbridge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.flowbridge.core.analysis.BranchAnalysis;
import com.flowbridge.core.analysis.BranchPointAnalyzer;
import com.flowbridge.core.config.CompilerConfig;
import com.flowbridge.core.model.BranchPoint;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.model.SourceGraph;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import com.flowbridge.core.palette.PaletteLoader;
import com.flowbridge.core.parser.ParseResult;
import com.flowbridge.core.parser.SourceGraphParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a workflow without emitting anything.
 *
 * <p>Parses the workflow, loads the palette and prints the resolved entry node, the excluded
 * orphan nodes and every branch point with its routing decision.
 */
@Command(
    name = "validate",
    description = "Parse and analyze a workflow and report its branch points",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Workflow document (JSON)")
    private Path source;

    @Option(names = {"-p", "--palette"}, description = "Palette directory or file (default: bundled palette)")
    private Path palette;

    @Option(
        names = {"--max-routing-depth"},
        description = "Deepest BFS layer whose branch points get a classifier and gates"
    )
    private int maxRoutingDepth = CompilerConfig.DEFAULT_MAX_ROUTING_DEPTH;

    @Override
    public Integer call() {
        try {
            log.info("Validating workflow: {}", source);

            ComponentPaletteRegistry registry =
                new PaletteLoader(List.of(CompilerConfig.DEFAULT_PLACEHOLDER_MARKER)).load(palette);
            System.out.println("✓ Palette provides " + registry.types());

            ParseResult parsed = new SourceGraphParser().read(source);
            SourceGraph graph = parsed.graph();
            System.out.println("✓ Workflow '" + graph.name() + "': " + graph.nodes().size() + " nodes, "
                + graph.edges().size() + " edges");
            System.out.println("  Entry node: " + graph.entryNodeId());
            if (!graph.orphanNodeIds().isEmpty()) {
                System.out.println("  Excluded orphans: " + String.join(", ", graph.orphanNodeIds()));
            }

            BranchAnalysis analysis = new BranchPointAnalyzer(maxRoutingDepth).analyze(graph);
            if (analysis.branchPoints().isEmpty()) {
                System.out.println("  No branch points");
            }
            for (BranchPoint branchPoint : analysis.branchPoints()) {
                System.out.printf("  • %s (depth %d, %d successors): %s%n",
                    branchPoint.nodeId(), branchPoint.depth(), branchPoint.outgoing().size(),
                    branchPoint.isNear() ? "routed" : "fan-out");
            }

            List<CompilationWarning> warnings = new ArrayList<>(parsed.warnings());
            warnings.addAll(analysis.warnings());
            for (CompilationWarning warning : warnings) {
                System.out.println("  ! " + warning);
            }

            System.out.println();
            System.out.println("✓ Workflow is valid");
            return 0;

        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
