package com.flowbridge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.flowbridge.core.compiler.CompilationMode;
import com.flowbridge.core.compiler.CompilationResult;
import com.flowbridge.core.compiler.FlowCompiler;
import com.flowbridge.core.config.CompilerConfig;
import com.flowbridge.core.config.ConfigLoader;
import com.flowbridge.core.emit.EmittedDocument;
import com.flowbridge.core.emit.EmitterConfig;
import com.flowbridge.core.emit.EmitterRegistry;
import com.flowbridge.core.emit.TargetEmitter;
import com.flowbridge.core.model.CompilationWarning;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import com.flowbridge.core.palette.PaletteLoader;
import com.flowbridge.core.parser.ParseResult;
import com.flowbridge.core.parser.SourceGraphParser;
import com.flowbridge.core.renderer.GeneratedFile;
import com.flowbridge.core.renderer.GeneratedOutput;
import com.flowbridge.core.renderer.OutputRenderer;
import com.flowbridge.core.renderer.RenderContext;
import com.flowbridge.core.validate.TargetDocumentValidator;
import com.flowbridge.core.validate.ValidationReport;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to compile a conversational workflow into a pipeline document.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration and apply command-line overrides</li>
 *   <li>Load the component palette</li>
 *   <li>Parse the workflow document</li>
 *   <li>Compile it into a target graph</li>
 *   <li>Emit the pipeline document, plus report and preview when requested</li>
 *   <li>Validate the emitted document against the palette</li>
 *   <li>Render the files to disk or standard output</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Writes booking_pipeline.json next to booking.json
 * flowbridge compile booking.json
 *
 * # Custom palette, fixed ids, output to stdout
 * flowbridge compile booking.json -p ./palette --seed 7 --stdout
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile a conversational workflow into a pipeline document",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    private static final String DOCUMENT_EMITTER = "langflow-json";
    private static final String REPORT_EMITTER = "markdown-report";
    private static final String DIAGRAM_EMITTER = "mermaid";

    @Parameters(index = "0", description = "Workflow document (JSON)")
    private Path source;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: <source-stem>_pipeline.json beside the source)"
    )
    private Path output;

    @Option(
        names = {"-p", "--palette"},
        description = "Palette directory or file (overrides config; default: bundled palette)"
    )
    private Path palette;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: flowbridge.yaml)"
    )
    private Path configPath = Paths.get("flowbridge.yaml");

    @Option(names = {"--seed"}, description = "Seed for deterministic component ids")
    private Long seed;

    @Option(
        names = {"--max-routing-depth"},
        description = "Deepest BFS layer whose branch points get a classifier and gates"
    )
    private Integer maxRoutingDepth;

    @Option(
        names = {"--mode"},
        description = "Compilation mode: routed or unified (default: ${DEFAULT-VALUE})",
        defaultValue = "routed"
    )
    private String mode;

    @Option(names = {"--report"}, description = "Also write a Markdown compilation report")
    private boolean report;

    @Option(names = {"--diagram"}, description = "Also write a Mermaid flow preview")
    private boolean diagram;

    @Option(names = {"--skip-validation"}, description = "Do not validate the emitted document")
    private boolean skipValidation;

    @Option(names = {"--stdout"}, description = "Print output to standard output instead of writing files")
    private boolean stdout;

    @Override
    public Integer call() {
        PrintStream status = stdout ? System.err : System.out;
        try {
            log.info("Compiling workflow: {}", source.toAbsolutePath());

            CompilerConfig config = loadConfiguration();
            CompilationMode compilationMode = CompilationMode.parse(mode);

            PaletteLoader loader = new PaletteLoader(config.palette().placeholderMarkers());
            String paletteDirectory = config.palette().directory();
            ComponentPaletteRegistry registry = loader.load(paletteDirectory != null ? Path.of(paletteDirectory) : null);
            status.println("✓ Loaded " + registry.blueprints().size() + " palette blueprints");

            ParseResult parsed = new SourceGraphParser().read(source);
            status.println("✓ Parsed workflow '" + parsed.graph().name() + "' ("
                + parsed.graph().nodes().size() + " nodes, " + parsed.graph().edges().size() + " edges)");

            CompilationResult result = new FlowCompiler(registry, config).compile(parsed, compilationMode);
            status.println("✓ Compiled " + result.graph().instances().size() + " components, "
                + result.graph().connections().size() + " connections, "
                + result.plans().size() + " routed branch point(s)");
            for (CompilationWarning warning : result.warnings()) {
                status.println("  ! " + warning);
            }

            EmitterConfig emitterConfig = new EmitterConfig(config.output().pretty(), Map.of());
            EmittedDocument document = emitter(DOCUMENT_EMITTER).emit(result, emitterConfig);

            if (!skipValidation) {
                ValidationReport validation = new TargetDocumentValidator(registry, loader).validate(document.content());
                if (!validation.isValid()) {
                    System.err.println("✗ Emitted document failed validation:");
                    validation.problems().forEach(p -> System.err.println("  - " + p));
                    return 1;
                }
                status.println("✓ Validated " + validation.nodeCount() + " nodes, " + validation.edgeCount() + " edges");
            }

            GeneratedOutput generated = collectOutput(result, document, emitterConfig, config);
            renderOutput(generated);
            if (stdout) {
                status.println("✓ Printed " + generated.files().size() + " file(s)");
            } else {
                generated.fileNames().forEach(name -> status.println("✓ Wrote " + outputDirectory().resolve(name)));
            }
            return 0;

        } catch (Exception e) {
            log.error("Compilation failed", e);
            System.err.println("✗ Compilation failed: " + e.getMessage());
            return 1;
        }
    }

    private CompilerConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath);
        CompilerConfig config = ConfigLoader.load(configPath);
        if (palette != null) {
            config = config.withPaletteDirectory(palette.toString());
        }
        if (seed != null) {
            config = config.withIdSeed(seed);
        }
        if (maxRoutingDepth != null) {
            config = config.withMaxRoutingDepth(maxRoutingDepth);
        }
        return config;
    }

    private GeneratedOutput collectOutput(CompilationResult result, EmittedDocument document,
                                          EmitterConfig emitterConfig, CompilerConfig config) {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.named(outputFileName(), document));
        String stem = stem(source);
        if (report || config.output().report()) {
            files.add(GeneratedFile.of(stem, emitter(REPORT_EMITTER).emit(result, emitterConfig)));
        }
        if (diagram || config.output().diagram()) {
            files.add(GeneratedFile.of(stem, emitter(DIAGRAM_EMITTER).emit(result, emitterConfig)));
        }
        return new GeneratedOutput(files);
    }

    private void renderOutput(GeneratedOutput generated) {
        String rendererId = stdout ? "console" : "filesystem";
        log.debug("Discovering output renderers via ServiceLoader");
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);

        OutputRenderer renderer = renderers.stream()
            .filter(r -> rendererId.equals(r.getId()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Output renderer not found: " + rendererId));

        RenderContext context = RenderContext.of(
            outputDirectory(),
            Map.of("console.showHeaders", String.valueOf(generated.files().size() > 1))
        );
        log.debug("Rendering output with: {}", renderer.getId());
        renderer.render(generated, context);
    }

    private static TargetEmitter emitter(String id) {
        return EmitterRegistry.find(id)
            .orElseThrow(() -> new IllegalStateException("Emitter not found: " + id));
    }

    private Path outputDirectory() {
        Path reference = output != null ? output.toAbsolutePath() : source.toAbsolutePath();
        Path parent = reference.getParent();
        return parent != null ? parent : Paths.get("").toAbsolutePath();
    }

    private String outputFileName() {
        if (output != null) {
            return output.getFileName().toString();
        }
        return stem(source) + "_pipeline.json";
    }

    private static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
