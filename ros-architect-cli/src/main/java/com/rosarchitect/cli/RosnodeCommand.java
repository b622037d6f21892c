package com.rosarchitect.cli;

import com.rosarchitect.core.config.ProjectConfig;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.query.ArchitectureQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.Map;

/**
 * Simulated {@code rosnode}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ros-architect rosnode robot.launch list
 * ros-architect rosnode robot.launch info /robot1/driver
 * }</pre>
 */
@Command(
    name = "rosnode",
    description = "List and describe the nodes of a launch file",
    mixinStandardHelpOptions = true
)
public class RosnodeCommand extends AbstractArchitectureCommand {

    private static final Logger log = LoggerFactory.getLogger(RosnodeCommand.class);

    @Parameters(index = "0", description = "Launch file")
    private String launchFile;

    @Parameters(index = "1", description = "Verb: list or info")
    private String verb;

    @Parameters(index = "2", arity = "0..1", description = "Node name (info)")
    private String node;

    @Override
    protected int execute(ProjectConfig config) {
        String normalizedVerb = verb.toLowerCase(Locale.ROOT);
        if (!"list".equals(normalizedVerb) && !"info".equals(normalizedVerb)) {
            log.error("Unknown verb: {}. Use: list or info", verb);
            return 1;
        }
        if ("info".equals(normalizedVerb) && node == null) {
            log.error("rosnode info requires a node name");
            return 1;
        }

        ArchitectureQuery query = new ArchitectureQuery(recover(config, launchFile, Map.of()));
        if ("list".equals(normalizedVerb)) {
            for (ResolvedNodeInstance instance : query.listNodes()) {
                System.out.println(instance.fullName() + (instance.modeled() ? "" : " (unmodeled)"));
            }
            return 0;
        }

        ResolvedNodeInstance instance = query.describeNode(node);
        System.out.println("Node [" + instance.fullName() + "]");
        System.out.println("Executable: " + instance.record().packageName() + "/" + instance.record().executable());
        System.out.println("Launched at: " + instance.record().location());
        if (!instance.modeled()) {
            System.out.println("Model: none");
        }
        System.out.println();
        RostopicCommand.printNodes("Publications:", query.publicationsOf(instance.fullName()));
        System.out.println();
        RostopicCommand.printNodes("Subscriptions:", query.subscriptionsOf(instance.fullName()));
        System.out.println();
        RostopicCommand.printNodes("Services:", query.servicesOf(instance.fullName()));
        return 0;
    }
}
