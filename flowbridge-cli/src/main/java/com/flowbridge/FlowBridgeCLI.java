package com.flowbridge;

import com.flowbridge.cli.CompileCommand;
import com.flowbridge.cli.ListCommand;
import com.flowbridge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for FlowBridge.
 *
 * <p>FlowBridge compiles conversational workflow documents into pipeline documents for a
 * visual dataflow runtime.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile a workflow into a pipeline document</li>
 *   <li>{@code validate} - Parse and analyze a workflow without emitting anything</li>
 *   <li>{@code list} - List palette components, emitters or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Compile with the bundled palette
 * flowbridge compile booking.json
 *
 * # Deterministic ids, report and preview beside the output
 * flowbridge compile booking.json --seed 42 --report --diagram -o out/booking.json
 *
 * # Inspect branch points
 * flowbridge -v validate booking.json
 * }</pre>
 */
@Command(
    name = "flowbridge",
    mixinStandardHelpOptions = true,
    version = "FlowBridge 1.0.0-SNAPSHOT",
    description = "Compiles conversational workflows into dataflow pipeline documents",
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class FlowBridgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FlowBridgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("FlowBridge - Conversational Workflow to Pipeline Compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'flowbridge --help' to see available commands");
        System.out.println("Use 'flowbridge <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        FlowBridgeCLI cli = new FlowBridgeCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
