package com.rosarchitect.cli;

import com.rosarchitect.core.config.ProjectConfig;
import com.rosarchitect.core.config.ProjectConfig.LaunchConfig;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.render.ArchitectureFormatter;
import com.rosarchitect.core.render.ArchitectureFormatters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command to recover and print the architecture of a launch file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print a text summary
 * ros-architect launch src/bringup/launch/robot.launch --workspace src
 *
 * # Override arguments and emit JSON
 * ros-architect launch robot.launch --arg sim:=true --format json
 *
 * # Analyze every launch file listed in rosarchitect.yaml
 * ros-architect launch
 * }</pre>
 */
@Command(
    name = "launch",
    description = "Recover the architecture of a launch file",
    mixinStandardHelpOptions = true
)
public class LaunchCommand extends AbstractArchitectureCommand {

    private static final Logger log = LoggerFactory.getLogger(LaunchCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Launch file (default: the launches listed in the configuration file)"
    )
    private String launchFile;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text, json, mermaid or acme (overrides config)"
    )
    private String format;

    @Override
    protected int execute(ProjectConfig config) {
        String formatId = format != null ? format : config.output().format();
        Optional<ArchitectureFormatter> formatter = ArchitectureFormatters.find(formatId);
        if (formatter.isEmpty()) {
            String available = ArchitectureFormatters.available().stream()
                .map(ArchitectureFormatter::getId)
                .collect(Collectors.joining(", "));
            log.error("Unknown format: {}. Use: {}", formatId, available);
            return 1;
        }

        List<LaunchConfig> launches = launchFile != null
            ? List.of(new LaunchConfig(launchFile, Map.of()))
            : config.launches();
        if (launches.isEmpty()) {
            log.error("No launch file given and none configured");
            return 1;
        }

        for (LaunchConfig launch : launches) {
            Architecture architecture = recover(config, launch.filename(), launch.arguments());
            System.out.print(formatter.get().format(architecture));
        }
        return 0;
    }
}
