package com.rosarchitect.cli;

import com.rosarchitect.core.config.ProjectConfig;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.query.ArchitectureQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.Map;

/**
 * Simulated {@code rosservice}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ros-architect rosservice robot.launch list
 * ros-architect rosservice robot.launch info /robot1/set_mode
 * }</pre>
 */
@Command(
    name = "rosservice",
    description = "List and describe the services of a launch file",
    mixinStandardHelpOptions = true
)
public class RosserviceCommand extends AbstractArchitectureCommand {

    private static final Logger log = LoggerFactory.getLogger(RosserviceCommand.class);

    @Parameters(index = "0", description = "Launch file")
    private String launchFile;

    @Parameters(index = "1", description = "Verb: list or info")
    private String verb;

    @Parameters(index = "2", arity = "0..1", description = "Service name (info)")
    private String service;

    @Override
    protected int execute(ProjectConfig config) {
        String normalizedVerb = verb.toLowerCase(Locale.ROOT);
        if (!"list".equals(normalizedVerb) && !"info".equals(normalizedVerb)) {
            log.error("Unknown verb: {}. Use: list or info", verb);
            return 1;
        }
        if ("info".equals(normalizedVerb) && service == null) {
            log.error("rosservice info requires a service name");
            return 1;
        }

        ArchitectureQuery query = new ArchitectureQuery(recover(config, launchFile, Map.of()));
        if ("list".equals(normalizedVerb)) {
            query.listServices().forEach(System.out::println);
            return 0;
        }

        ServiceInfo info = query.describeService(service);
        System.out.println("Type: " + query.serviceType(service));
        System.out.println("Node: " + (info.providers().isEmpty() ? "None" : String.join(", ", info.providers())));
        if (info.hasProviderConflict()) {
            System.out.println("Warning: provided by " + info.providers().size() + " nodes");
        }
        System.out.println();
        RostopicCommand.printNodes("Callers:", info.callers());
        return 0;
    }
}
