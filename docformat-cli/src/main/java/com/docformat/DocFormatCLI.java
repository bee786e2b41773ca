package com.docformat;

import com.docformat.cli.RenderCommand;
import com.docformat.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocFormat.
 *
 * <p>DocFormat renders a documentation model (packages, types, members and their
 * documentation) into cross-linked HTML pages.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a model into HTML pages</li>
 *   <li>{@code validate} - Check that a model file loads</li>
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
 * docformat -v render -i model.json -o docs/api
 * }</pre>
 */
@Command(
    name = "docformat",
    mixinStandardHelpOptions = true,
    version = "DocFormat 1.0.0-SNAPSHOT",
    description = "Renders documentation models into HTML",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class
    }
)
public class DocFormatCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocFormatCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocFormat - Documentation Model Renderer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docformat --help' to see available commands");
        System.out.println("Use 'docformat <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line, applying the global logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocFormatCLI cli = new DocFormatCLI();
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
