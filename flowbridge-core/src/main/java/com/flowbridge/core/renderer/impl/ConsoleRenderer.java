package com.flowbridge.core.renderer.impl;

import com.flowbridge.core.renderer.GeneratedFile;
import com.flowbridge.core.renderer.GeneratedOutput;
import com.flowbridge.core.renderer.OutputRenderer;
import com.flowbridge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints generated files to a stream, by default standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors in headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - separator repeated between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - print a header per file ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p>With headers off and a single file the stream receives exactly the file content, so
 * {@code flowbridge compile flow.json --stdout} can be piped.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.flag("console.colors", false);
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        boolean showHeaders = context.flag("console.showHeaders", true);

        logger.debug("Printing {} files (colors: {}, headers: {})", output.files().size(), useColors, showHeaders);

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                printFileHeader(file, i + 1, total, useColors);
            }
            out.println(file.content());
            if (i < total - 1) {
                printSeparator(separator, useColors);
            }
        }
        out.flush();
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(pathColor + "File " + index + "/" + total + ": " + file.relativePath() + reset);
        if (file.contentType() != null && !file.contentType().isEmpty()) {
            out.println(metaColor + "Type: " + file.contentType() + reset);
        }
        out.println();
    }

    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        int repeatCount = Math.max(1, LINE_WIDTH / separator.length());
        out.println(color + separator.repeat(repeatCount) + reset);
    }
}
