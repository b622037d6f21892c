package com.rosarchitect;

import ch.qos.logback.classic.Level;
import com.rosarchitect.cli.LaunchCommand;
import com.rosarchitect.cli.ListCommand;
import com.rosarchitect.cli.RosnodeCommand;
import com.rosarchitect.cli.RosserviceCommand;
import com.rosarchitect.cli.RostopicCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ros-architect.
 *
 * <p>ros-architect recovers the communication graph of a ROS launch configuration
 * without starting any process.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code launch} - Recover and print the architecture of a launch file</li>
 *   <li>{@code rostopic} - Simulated {@code rostopic list|info|type}</li>
 *   <li>{@code rosservice} - Simulated {@code rosservice list|info}</li>
 *   <li>{@code rosnode} - Simulated {@code rosnode list|info}</li>
 *   <li>{@code list} - List built-in node models or output formats</li>
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
 * ros-architect launch robot.launch --workspace src --arg sim:=true
 * ros-architect -v rostopic robot.launch info /robot1/scan --workspace src
 * }</pre>
 */
@Command(
    name = "ros-architect",
    mixinStandardHelpOptions = true,
    version = "ros-architect 1.0.0-SNAPSHOT",
    description = "Static recovery of ROS launch architectures",
    subcommands = {
        LaunchCommand.class,
        RostopicCommand.class,
        RosserviceCommand.class,
        RosnodeCommand.class,
        ListCommand.class
    }
)
public class RosArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RosArchitectCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("ros-architect - Static recovery of ROS launch architectures");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'ros-architect --help' to see available commands");
        System.out.println("Use 'ros-architect <command> --help' for command-specific help");
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
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line; global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        RosArchitectCLI cli = new RosArchitectCLI();
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
