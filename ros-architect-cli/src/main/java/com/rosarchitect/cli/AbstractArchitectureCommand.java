package com.rosarchitect.cli;

import com.rosarchitect.core.config.ProjectConfig;
import com.rosarchitect.core.error.LaunchException;
import com.rosarchitect.core.error.UnknownNodeException;
import com.rosarchitect.core.error.UnknownServiceException;
import com.rosarchitect.core.error.UnknownTopicException;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.Diagnostic;
import com.rosarchitect.core.nodemodel.descriptor.ModelDescriptorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Base class of commands that recover an architecture and report on it.
 *
 * <p>Fatal launch errors, invalid model descriptors and unknown names are printed to
 * stderr and map to exit code 1; warnings are printed to stderr and do not change the
 * exit code.
 */
public abstract class AbstractArchitectureCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractArchitectureCommand.class);

    @Mixin
    protected LaunchOptions options;

    @Override
    public Integer call() {
        try {
            return execute(options.loadConfig());
        } catch (LaunchException e) {
            log.debug("Recovery failed", e);
            System.err.println("✗ " + e.describe());
            return 1;
        } catch (UnknownTopicException | UnknownServiceException | UnknownNodeException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (ModelDescriptorException | UncheckedIOException e) {
            log.debug("Configuration error", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command.
     *
     * @param config project configuration
     * @return exit code
     */
    protected abstract int execute(ProjectConfig config);

    /**
     * Recovers the architecture of a launch file and prints its warnings.
     *
     * @param config project configuration
     * @param launchFile root launch file
     * @param configured arguments configured for the launch file
     * @return recovered architecture
     */
    protected Architecture recover(ProjectConfig config, String launchFile, Map<String, String> configured) {
        Architecture architecture = options.createRecovery(config).recover(launchFile, options.arguments(configured));
        for (Diagnostic diagnostic : architecture.diagnostics()) {
            System.err.println("warning: " + diagnostic);
        }
        return architecture;
    }
}
