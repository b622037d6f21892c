package com.rosarchitect.cli;

import com.rosarchitect.core.nodemodel.NodeModel;
import com.rosarchitect.core.nodemodel.ServiceLoaderNodeModelRegistry;
import com.rosarchitect.core.render.ArchitectureFormatter;
import com.rosarchitect.core.render.ArchitectureFormatters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list built-in node models or output formats.
 *
 * <p>Discovers both via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ros-architect list models
 * ros-architect list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List built-in node models or output formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: models or formats"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "models", "model" -> listModels();
            case "formats", "format" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: models or formats", type);
                yield 1;
            }
        };
    }

    private int listModels() {
        System.out.println("Available Node Models:");
        System.out.println();

        List<NodeModel> models = new ServiceLoaderNodeModelRegistry().models();
        for (NodeModel model : models) {
            System.out.printf("  • %s/%s%n", model.getPackageName(), model.getExecutable());
            System.out.printf("    %s%n", model.getDescription());
        }

        if (models.isEmpty()) {
            System.out.println("  No node models found.");
        }
        return 0;
    }

    private int listFormats() {
        System.out.println("Available Formats:");
        System.out.println();

        List<ArchitectureFormatter> formatters = ArchitectureFormatters.available();
        for (ArchitectureFormatter formatter : formatters) {
            System.out.printf("  • %s (ID: %s)%n", formatter.getDisplayName(), formatter.getId());
        }

        if (formatters.isEmpty()) {
            System.out.println("  No formatters found.");
        }
        return 0;
    }
}
