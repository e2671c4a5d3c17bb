package com.stcode;

import com.stcode.cli.FormatCommand;
import com.stcode.cli.ParseCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for stcode.
 *
 * <p>stcode parses IEC 61131-3 Structured Text into a typed syntax tree and renders it
 * back as normalized source.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Parse files and report declarations and failures</li>
 *   <li>{@code format} - Parse files and write the normalized source</li>
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
 * # Check every .st file below src
 * stcode parse src
 *
 * # Reformat into a separate directory
 * stcode -v format src -o formatted
 * }</pre>
 */
@Command(
    name = "stcode",
    mixinStandardHelpOptions = true,
    version = "stcode 1.0.0-SNAPSHOT",
    description = "Structured Text parser and formatter",
    subcommands = {
        ParseCommand.class,
        FormatCommand.class
    }
)
public class StcodeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StcodeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("stcode - Structured Text parser and formatter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'stcode --help' to see available commands");
        System.out.println("Use 'stcode <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with the execution strategy that applies logging options
     * before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StcodeCLI cli = new StcodeCLI();
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
