package com.flowbridge.cli;

import com.flowbridge.core.config.CompilerConfig;
import com.flowbridge.core.emit.EmitterRegistry;
import com.flowbridge.core.emit.TargetEmitter;
import com.flowbridge.core.model.ComponentBlueprint;
import com.flowbridge.core.model.PortSpec;
import com.flowbridge.core.palette.ComponentPaletteRegistry;
import com.flowbridge.core.palette.PaletteLoader;
import com.flowbridge.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list palette components, emitters, or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Blueprints of the bundled palette, with their ports
 * flowbridge list components
 *
 * # Blueprints of a custom palette
 * flowbridge list components -p ./palette
 *
 * # Available emitters
 * flowbridge list emitters
 * }</pre>
 */
@Command(
    name = "list",
    description = "List palette components, emitters, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: components, emitters, or renderers"
    )
    private String type;

    @Option(names = {"-p", "--palette"}, description = "Palette directory or file (default: bundled palette)")
    private Path palette;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "components", "component" -> listComponents();
            case "emitters", "emitter" -> listEmitters();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: components, emitters, or renderers", type);
                System.err.println("✗ Unknown type: " + type);
                yield 1;
            }
        };
    }

    private int listComponents() {
        ComponentPaletteRegistry registry;
        try {
            registry = new PaletteLoader(List.of(CompilerConfig.DEFAULT_PLACEHOLDER_MARKER)).load(palette);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load palette", e);
            System.err.println("✗ Failed to load palette: " + e.getMessage());
            return 1;
        }

        System.out.println("Palette Components:");
        System.out.println();
        for (ComponentBlueprint blueprint : registry.blueprints()) {
            System.out.printf("  • %s (ID: %s)%n", blueprint.displayName(), blueprint.componentType().documentName());
            System.out.printf("    Runtime Type: %s%n", blueprint.runtimeType());
            System.out.printf("    Inputs: %s%n", describe(blueprint.inputPorts()));
            System.out.printf("    Outputs: %s%n", describe(blueprint.outputPorts()));
            System.out.println();
        }
        return 0;
    }

    private int listEmitters() {
        System.out.println("Available Emitters:");
        System.out.println();

        List<TargetEmitter> emitters = EmitterRegistry.discover();
        for (TargetEmitter emitter : emitters) {
            System.out.printf("  • %s (ID: %s)%n", emitter.getDisplayName(), emitter.getId());
            System.out.printf("    File Extension: .%s%n", emitter.getFileExtension());
            System.out.println();
        }
        if (emitters.isEmpty()) {
            System.out.println("  No emitters found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private static String describe(List<PortSpec> ports) {
        if (ports.isEmpty()) {
            return "-";
        }
        return ports.stream()
            .map(p -> p.name() + " " + p.dataKinds() + " " + p.role().name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
    }
}
