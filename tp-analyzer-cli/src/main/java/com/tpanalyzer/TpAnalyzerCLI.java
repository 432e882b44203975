package com.tpanalyzer;

import ch.qos.logback.classic.Level;
import com.tpanalyzer.cli.AnalyzeCommand;
import com.tpanalyzer.cli.FlowCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for TP Analyzer.
 *
 * <p>TP Analyzer reads teach pendant programs ({@code *.LS}) exported from a robot
 * controller and reports program classification, call graphs, register and I/O usage,
 * error handling and label-level control flow.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a directory of programs and write reports</li>
 *   <li>{@code flow} - Flow and state analysis of a single program</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * tp-analyzer analyze backup/ -o reports/
 * tp-analyzer -v analyze backup/ --format mermaid
 * tp-analyzer flow backup/A_1PA005.LS
 * }</pre>
 */
@Command(
    name = "tp-analyzer",
    mixinStandardHelpOptions = true,
    version = "TP Analyzer 1.0.0-SNAPSHOT",
    description = "Static analysis of teach pendant robot programs",
    subcommands = {
        AnalyzeCommand.class,
        FlowCommand.class
    }
)
public class TpAnalyzerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TpAnalyzerCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("TP Analyzer - Teach Pendant Program Analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'tp-analyzer --help' to see available commands");
        System.out.println("Use 'tp-analyzer <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options.
     *
     * <p>Runs before any subcommand, so the level also applies to {@code analyze} and
     * {@code flow}.
     */
    void configureLogging() {
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger root)) {
            log.debug("Logging backend is not Logback, leaving log levels unchanged");
            return;
        }

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before execution.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TpAnalyzerCLI cli = new TpAnalyzerCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
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
