package com.rosarchitect.core;

import com.rosarchitect.core.assembler.ArchitectureAssembler;
import com.rosarchitect.core.evaluator.LaunchEvaluation;
import com.rosarchitect.core.evaluator.LaunchEvaluator;
import com.rosarchitect.core.launch.LaunchSourceResolver;
import com.rosarchitect.core.launch.PackageLocator;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.nodemodel.NodeModelRegistry;
import com.rosarchitect.core.nodemodel.NodeModelResolver;
import com.rosarchitect.core.nodemodel.ServiceLoaderNodeModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recovers the architecture of one launch configuration: evaluate the launch files,
 * resolve node models, assemble the graph.
 *
 * <p>A recovery object holds no per-run state and can be reused. Any fatal error aborts
 * the run with a {@link com.rosarchitect.core.error.LaunchException}; no partial
 * architecture is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchitectureRecovery recovery = ArchitectureRecovery.builder()
 *     .sourceResolver(new FileSystemLaunchSourceResolver())
 *     .packageLocator(WorkspacePackageLocator.scan(workspaces))
 *     .threads(4)
 *     .build();
 * Architecture architecture = recovery.recover("robot.launch", Map.of("sim", "true"));
 * }</pre>
 */
public final class ArchitectureRecovery {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureRecovery.class);

    private final LaunchEvaluator evaluator;
    private final NodeModelResolver resolver;
    private final ArchitectureAssembler assembler;

    private ArchitectureRecovery(Builder builder) {
        this.evaluator = new LaunchEvaluator(builder.sourceResolver, builder.packageLocator, builder.environment);
        this.resolver = new NodeModelResolver(builder.registry, builder.threads);
        this.assembler = new ArchitectureAssembler();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the whole pipeline for one root launch file.
     *
     * @param launchFile root launch file
     * @param arguments top-level argument overrides
     * @return recovered architecture
     * @throws com.rosarchitect.core.error.LaunchException on any fatal error
     */
    public Architecture recover(String launchFile, Map<String, String> arguments) {
        log.info("Recovering architecture of {}", launchFile);
        LaunchEvaluation evaluation = evaluator.evaluate(launchFile, arguments);
        List<ResolvedNodeInstance> instances = resolver.resolve(evaluation.nodes(), evaluation.parameters());
        return assembler.assemble(evaluation.rootSource(), instances, evaluation.parameters());
    }

    /**
     * Builder for {@link ArchitectureRecovery}.
     */
    public static final class Builder {
        private LaunchSourceResolver sourceResolver;
        private PackageLocator packageLocator = PackageLocator.none();
        private NodeModelRegistry registry;
        private Map<String, String> environment = Map.of();
        private int threads = 1;

        private Builder() {
        }

        public Builder sourceResolver(LaunchSourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
            return this;
        }

        public Builder packageLocator(PackageLocator packageLocator) {
            this.packageLocator = packageLocator;
            return this;
        }

        /**
         * Sets the node model registry; defaults to the models discovered on the classpath.
         *
         * @param registry node model lookup
         * @return this builder
         */
        public Builder registry(NodeModelRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public ArchitectureRecovery build() {
            Objects.requireNonNull(sourceResolver, "sourceResolver must not be null");
            if (registry == null) {
                registry = new ServiceLoaderNodeModelRegistry();
            }
            return new ArchitectureRecovery(this);
        }
    }
}
