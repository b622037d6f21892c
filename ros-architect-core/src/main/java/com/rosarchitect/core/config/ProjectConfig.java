package com.rosarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration for ros-architect.
 *
 * <p>Loaded from {@code rosarchitect.yaml}. Defines where packages and model descriptors
 * live, the environment seen by {@code $(env)}, resolver and output settings, and the
 * launch files to analyze.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * workspaces:
 *   - ./src
 *
 * models:
 *   - ./models/navigation.yaml
 *
 * environment:
 *   ROBOT_NAME: turtle
 *
 * resolver:
 *   threads: 4
 *
 * output:
 *   format: json
 *
 * launches:
 *   - filename: ./src/bringup/launch/robot.launch
 *     arguments:
 *       sim: "true"
 * }</pre>
 *
 * @param workspaces directories searched for {@code package.xml}
 * @param models YAML model descriptor files
 * @param environment environment variables for {@code $(env)} and {@code $(optenv)}
 * @param resolver node model resolution settings
 * @param output output settings
 * @param launches launch files analyzed when no launch file is given on the command line
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("workspaces") List<String> workspaces,
    @JsonProperty("models") List<String> models,
    @JsonProperty("environment") Map<String, String> environment,
    @JsonProperty("resolver") ResolverConfig resolver,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("launches") List<LaunchConfig> launches
) {
    /**
     * Compact constructor filling in defaults for absent sections.
     */
    public ProjectConfig {
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
        models = models == null ? List.of() : List.copyOf(models);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        if (resolver == null) {
            resolver = ResolverConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
        launches = launches == null ? List.of() : List.copyOf(launches);
    }

    /**
     * Creates the configuration used when no file is available.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(List.of(), List.of(), Map.of(), ResolverConfig.defaults(),
            OutputConfig.defaults(), List.of());
    }

    /**
     * Node model resolution settings.
     *
     * @param threads worker threads resolving node models (at least 1)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResolverConfig(
        @JsonProperty("threads") Integer threads
    ) {
        public ResolverConfig {
            if (threads == null || threads < 1) {
                threads = 1;
            }
        }

        public static ResolverConfig defaults() {
            return new ResolverConfig(1);
        }
    }

    /**
     * Output settings.
     *
     * @param format default formatter identifier
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format
    ) {
        public OutputConfig {
            if (format == null || format.isBlank()) {
                format = "text";
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig("text");
        }
    }

    /**
     * One launch file to analyze.
     *
     * @param filename launch file path
     * @param arguments top-level argument overrides
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LaunchConfig(
        @JsonProperty("filename") String filename,
        @JsonProperty("arguments") Map<String, String> arguments
    ) {
        public LaunchConfig {
            Objects.requireNonNull(filename, "launch filename must not be null");
            arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        }
    }
}
