package com.rosarchitect.cli;

import com.rosarchitect.core.ArchitectureRecovery;
import com.rosarchitect.core.config.ConfigLoader;
import com.rosarchitect.core.config.ProjectConfig;
import com.rosarchitect.core.nodemodel.CompositeNodeModelRegistry;
import com.rosarchitect.core.nodemodel.MapNodeModelRegistry;
import com.rosarchitect.core.nodemodel.NodeModelRegistry;
import com.rosarchitect.core.nodemodel.ServiceLoaderNodeModelRegistry;
import com.rosarchitect.core.nodemodel.descriptor.DescriptorModelLoader;
import com.rosarchitect.workspace.FileSystemLaunchSourceResolver;
import com.rosarchitect.workspace.WorkspacePackageLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options shared by every command that recovers an architecture.
 *
 * <p>Command-line values are combined with {@code rosarchitect.yaml}: workspaces and model
 * files are added to the configured ones, arguments and thread count override them.
 */
public class LaunchOptions {

    private static final Logger log = LoggerFactory.getLogger(LaunchOptions.class);

    @Option(
        names = {"-w", "--workspace"},
        description = "Workspace directory searched for package.xml (repeatable)"
    )
    private List<Path> workspaces = new ArrayList<>();

    @Option(
        names = {"-a", "--arg"},
        description = "Launch argument override NAME=VALUE or NAME:=VALUE (repeatable)"
    )
    private Map<String, String> arguments = new LinkedHashMap<>();

    @Option(
        names = {"-m", "--models"},
        description = "YAML node model descriptor file (repeatable)"
    )
    private List<Path> models = new ArrayList<>();

    @Option(
        names = {"--threads"},
        description = "Worker threads resolving node models (overrides config)"
    )
    private Integer threads;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: rosarchitect.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    /**
     * Loads the configuration file.
     *
     * @return configuration, or defaults when the file is absent or invalid
     */
    public ProjectConfig loadConfig() {
        return ConfigLoader.load(configPath);
    }

    /**
     * Creates the recovery pipeline.
     *
     * @param config project configuration
     * @return recovery reading files from disk
     * @throws com.rosarchitect.core.nodemodel.descriptor.ModelDescriptorException if a model file is invalid
     */
    public ArchitectureRecovery createRecovery(ProjectConfig config) {
        Set<Path> allWorkspaces = new LinkedHashSet<>(workspaces);
        config.workspaces().forEach(workspace -> allWorkspaces.add(Paths.get(workspace)));

        Map<String, String> environment = new HashMap<>(System.getenv());
        environment.putAll(config.environment());

        int resolverThreads = threads != null ? threads : config.resolver().threads();
        if (resolverThreads < 1) {
            log.warn("Invalid thread count {}; using 1", resolverThreads);
            resolverThreads = 1;
        }
        log.debug("Workspaces: {}, resolver threads: {}", allWorkspaces, resolverThreads);

        return ArchitectureRecovery.builder()
            .sourceResolver(new FileSystemLaunchSourceResolver())
            .packageLocator(WorkspacePackageLocator.scan(new ArrayList<>(allWorkspaces)))
            .registry(createRegistry(config))
            .environment(environment)
            .threads(resolverThreads)
            .build();
    }

    /**
     * Creates the model registry: descriptor files first, then the built-in models.
     *
     * @param config project configuration
     * @return node model registry
     */
    public NodeModelRegistry createRegistry(ProjectConfig config) {
        Set<Path> modelFiles = new LinkedHashSet<>(models);
        config.models().forEach(model -> modelFiles.add(Paths.get(model)));

        DescriptorModelLoader loader = new DescriptorModelLoader();
        MapNodeModelRegistry.Builder descriptors = MapNodeModelRegistry.builder();
        for (Path modelFile : modelFiles) {
            descriptors.registerAll(loader.load(modelFile));
        }
        return new CompositeNodeModelRegistry(List.of(descriptors.build(), new ServiceLoaderNodeModelRegistry()));
    }

    /**
     * Returns the argument overrides for a launch file.
     *
     * @param configured arguments configured for the launch file
     * @return configured arguments overridden by command-line ones
     */
    public Map<String, String> arguments(Map<String, String> configured) {
        Map<String, String> merged = new LinkedHashMap<>(configured);
        arguments.forEach((name, value) -> merged.put(name.endsWith(":") ? name.substring(0, name.length() - 1) : name,
            value));
        return merged;
    }
}
