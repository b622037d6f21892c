package com.rosarchitect.cli;

import com.rosarchitect.core.config.ProjectConfig;
import com.rosarchitect.core.model.TopicInfo;
import com.rosarchitect.core.query.ArchitectureQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Simulated {@code rostopic}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ros-architect rostopic robot.launch list
 * ros-architect rostopic robot.launch info /robot1/scan
 * ros-architect rostopic robot.launch type /robot1/scan
 * }</pre>
 */
@Command(
    name = "rostopic",
    description = "List and describe the topics of a launch file",
    mixinStandardHelpOptions = true
)
public class RostopicCommand extends AbstractArchitectureCommand {

    private static final Logger log = LoggerFactory.getLogger(RostopicCommand.class);

    @Parameters(index = "0", description = "Launch file")
    private String launchFile;

    @Parameters(index = "1", description = "Verb: list, info or type")
    private String verb;

    @Parameters(index = "2", arity = "0..1", description = "Topic name (info, type)")
    private String topic;

    @Override
    protected int execute(ProjectConfig config) {
        String normalizedVerb = verb.toLowerCase(Locale.ROOT);
        if (!List.of("list", "info", "type").contains(normalizedVerb)) {
            log.error("Unknown verb: {}. Use: list, info or type", verb);
            return 1;
        }
        if (!"list".equals(normalizedVerb) && topic == null) {
            log.error("rostopic {} requires a topic name", normalizedVerb);
            return 1;
        }

        ArchitectureQuery query = new ArchitectureQuery(recover(config, launchFile, Map.of()));
        switch (normalizedVerb) {
            case "list" -> query.listTopics().forEach(System.out::println);
            case "type" -> System.out.println(query.topicType(topic));
            default -> printInfo(query, topic);
        }
        return 0;
    }

    private static void printInfo(ArchitectureQuery query, String name) {
        TopicInfo info = query.describeTopic(name);
        System.out.println("Type: " + query.topicType(name));
        System.out.println();
        printNodes("Publishers:", info.publishers());
        System.out.println();
        printNodes("Subscribers:", info.subscribers());
    }

    static void printNodes(String title, List<String> nodes) {
        System.out.println(title);
        if (nodes.isEmpty()) {
            System.out.println(" None");
        }
        for (String node : nodes) {
            System.out.println(" * " + node);
        }
    }
}
