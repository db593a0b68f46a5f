package com.reqgraph;

import ch.qos.logback.classic.Level;
import com.reqgraph.cli.GapsCommand;
import com.reqgraph.cli.ImpactCommand;
import com.reqgraph.cli.IndexCommand;
import com.reqgraph.cli.QueryCommand;
import com.reqgraph.cli.SyncCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ReqGraph.
 *
 * <p>ReqGraph indexes a requirements document corpus into an entity/relationship graph and
 * answers queries, change-impact analyses and synchronization requests against it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code index} - Build the derived index from the authoritative documents</li>
 *   <li>{@code query} - Run keyword, relationship, pattern, impact or coverage queries</li>
 *   <li>{@code impact} - Analyze change impact, critical dependencies and removals</li>
 *   <li>{@code sync} - Detect and reconcile drift between documents and index</li>
 *   <li>{@code gaps} - Report coverage gaps</li>
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
 * reqgraph index
 * reqgraph query "user authentication"
 * reqgraph impact FR-001 --change-type removal
 * reqgraph sync --full -v
 * }</pre>
 */
@Command(
    name = "reqgraph",
    mixinStandardHelpOptions = true,
    version = "ReqGraph 1.0.0-SNAPSHOT",
    description = "Requirements graph indexing, query, impact analysis and synchronization",
    subcommands = {
        IndexCommand.class,
        QueryCommand.class,
        ImpactCommand.class,
        SyncCommand.class,
        GapsCommand.class
    }
)
public class ReqGraphCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("ReqGraph - Requirements graph engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'reqgraph --help' to see available commands");
        System.out.println("Use 'reqgraph <command> --help' for command-specific help");
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
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ReqGraphCLI cli = new ReqGraphCLI();
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
