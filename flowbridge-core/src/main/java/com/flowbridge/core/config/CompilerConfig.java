package com.flowbridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for FlowBridge compilations.
 *
 * <p>Loaded from {@code flowbridge.yaml}. Every section is optional; missing sections and
 * missing values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * routing:
 *   maxDepth: 1
 *   operator: contains
 *   caseSensitive: false
 *   gateParameters:
 *     max_iterations: 10
 *     default_route: false_result
 *
 * palette:
 *   directory: "./palette"
 *   placeholderMarkers:
 *     - YOUR_API_KEY_HERE
 *
 * output:
 *   idSeed: 42
 *   pretty: true
 *   report: true
 *   diagram: false
 * }</pre>
 *
 * @param routing branch routing settings
 * @param palette component palette settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerConfig(
    @JsonProperty("routing") RoutingSettings routing,
    @JsonProperty("palette") PaletteSettings palette,
    @JsonProperty("output") OutputSettings output
) {
    /** Deepest BFS layer whose branch points still get a classifier and gates. */
    public static final int DEFAULT_MAX_ROUTING_DEPTH = 1;

    /** Gate comparison operator written into every gate. */
    public static final String DEFAULT_OPERATOR = "contains";

    /** Placeholder text that marks a required field as never filled in. */
    public static final String DEFAULT_PLACEHOLDER_MARKER = "YOUR_API_KEY_HERE";

    /** Gate fields set on every gate whose blueprint declares them. */
    public static final Map<String, Object> DEFAULT_GATE_PARAMETERS =
        Map.of("max_iterations", 10, "default_route", "false_result");

    /**
     * Compact constructor filling in missing sections.
     */
    public CompilerConfig {
        routing = RoutingSettings.merge(routing);
        palette = PaletteSettings.merge(palette);
        output = OutputSettings.merge(output);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(null, null, null);
    }

    /**
     * Returns a copy with another routing depth.
     *
     * @param maxDepth deepest routed BFS layer
     * @return updated configuration
     */
    public CompilerConfig withMaxRoutingDepth(int maxDepth) {
        return new CompilerConfig(
            new RoutingSettings(maxDepth, routing.operator(), routing.caseSensitive(), routing.gateParameters()),
            palette, output);
    }

    /**
     * Returns a copy with a fixed id seed.
     *
     * @param idSeed seed for instance id generation
     * @return updated configuration
     */
    public CompilerConfig withIdSeed(long idSeed) {
        return new CompilerConfig(routing, palette,
            new OutputSettings(idSeed, output.pretty(), output.report(), output.diagram()));
    }

    /**
     * Returns a copy reading blueprints from another directory.
     *
     * @param directory palette directory or file
     * @return updated configuration
     */
    public CompilerConfig withPaletteDirectory(String directory) {
        return new CompilerConfig(routing,
            new PaletteSettings(directory, palette.placeholderMarkers()), output);
    }

    /**
     * Branch routing settings.
     *
     * @param maxDepth deepest BFS layer (entry = 0) whose branch points are routed
     * @param operator gate comparison operator written into every gate
     * @param caseSensitive whether gate comparisons are case-sensitive
     * @param gateParameters extra gate fields set when the gate blueprint declares them; fields the
     *                       compiler sets itself (match text, operator, required fields) are ignored
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RoutingSettings(
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("operator") String operator,
        @JsonProperty("caseSensitive") Boolean caseSensitive,
        @JsonProperty("gateParameters") Map<String, Object> gateParameters
    ) {
        public RoutingSettings {
            if (operator != null && operator.isBlank()) {
                throw new IllegalArgumentException("routing.operator must not be blank");
            }
        }

        static RoutingSettings merge(RoutingSettings settings) {
            if (settings == null) {
                return new RoutingSettings(DEFAULT_MAX_ROUTING_DEPTH, DEFAULT_OPERATOR, false,
                    DEFAULT_GATE_PARAMETERS);
            }
            return new RoutingSettings(
                settings.maxDepth() != null ? settings.maxDepth() : DEFAULT_MAX_ROUTING_DEPTH,
                settings.operator() != null ? settings.operator() : DEFAULT_OPERATOR,
                settings.caseSensitive() != null ? settings.caseSensitive() : Boolean.FALSE,
                settings.gateParameters() != null ? Map.copyOf(settings.gateParameters()) : DEFAULT_GATE_PARAMETERS
            );
        }
    }

    /**
     * Component palette settings.
     *
     * @param directory directory (or single file) of blueprint documents; null uses the bundled palette
     * @param placeholderMarkers values that make a required field count as empty
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaletteSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("placeholderMarkers") List<String> placeholderMarkers
    ) {
        static PaletteSettings merge(PaletteSettings settings) {
            if (settings == null) {
                return new PaletteSettings(null, List.of(DEFAULT_PLACEHOLDER_MARKER));
            }
            return new PaletteSettings(
                settings.directory(),
                settings.placeholderMarkers() != null
                    ? List.copyOf(settings.placeholderMarkers())
                    : List.of(DEFAULT_PLACEHOLDER_MARKER)
            );
        }
    }

    /**
     * Output settings.
     *
     * @param idSeed seed for deterministic instance ids; null picks a random seed per run
     * @param pretty whether to pretty-print the emitted document
     * @param report whether to emit the Markdown compilation report
     * @param diagram whether to emit the Mermaid preview
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("idSeed") Long idSeed,
        @JsonProperty("pretty") Boolean pretty,
        @JsonProperty("report") Boolean report,
        @JsonProperty("diagram") Boolean diagram
    ) {
        static OutputSettings merge(OutputSettings settings) {
            if (settings == null) {
                return new OutputSettings(null, true, false, false);
            }
            return new OutputSettings(
                settings.idSeed(),
                settings.pretty() != null ? settings.pretty() : Boolean.TRUE,
                settings.report() != null ? settings.report() : Boolean.FALSE,
                settings.diagram() != null ? settings.diagram() : Boolean.FALSE
            );
        }
    }
}
