package com.rosarchitect.core.nodemodel;

import com.rosarchitect.core.model.Diagnostic;
import com.rosarchitect.core.model.DiagnosticKind;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ResolvedNodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Evaluates the node model of every resolved node record.
 *
 * <p>Nodes are independent of each other, so resolution may run on a bounded pool. The
 * returned instances always follow the order of the input records.
 *
 * <p>Nodelets are handled here: {@code nodelet/nodelet manager} is a modeled manager
 * without interfaces, and {@code nodelet/nodelet standalone PKG/TYPE} or
 * {@code nodelet/nodelet load PKG/TYPE MANAGER} resolve the model of {@code PKG/TYPE}.
 */
public class NodeModelResolver {

    private static final Logger log = LoggerFactory.getLogger(NodeModelResolver.class);

    private static final String NODELET_PACKAGE = "nodelet";
    private static final String NODELET_EXECUTABLE = "nodelet";

    private final NodeModelRegistry registry;
    private final int threads;

    /**
     * Creates a resolver.
     *
     * @param registry node model lookup
     * @param threads worker threads; 1 resolves on the calling thread
     */
    public NodeModelResolver(NodeModelRegistry registry, int threads) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1 but was " + threads);
        }
        this.threads = threads;
    }

    /**
     * Resolves every record.
     *
     * @param records node records in evaluation order
     * @param launchParameters parameters assigned by the launch files
     * @return node instances in evaluation order
     */
    public List<ResolvedNodeInstance> resolve(List<ResolvedNodeRecord> records, Map<String, Object> launchParameters) {
        if (threads == 1 || records.size() < 2) {
            List<ResolvedNodeInstance> instances = new ArrayList<>(records.size());
            for (ResolvedNodeRecord record : records) {
                instances.add(resolve(record, launchParameters));
            }
            return instances;
        }

        int poolSize = Math.min(threads, records.size());
        log.debug("Resolving {} node(s) on {} thread(s)", records.size(), poolSize);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<ResolvedNodeInstance>> futures = new ArrayList<>(records.size());
            for (ResolvedNodeRecord record : records) {
                futures.add(executor.submit(() -> resolve(record, launchParameters)));
            }

            List<ResolvedNodeInstance> instances = new ArrayList<>(records.size());
            for (Future<ResolvedNodeInstance> future : futures) {
                instances.add(future.get());
            }
            return instances;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving node models", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Node model resolution failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Resolves one record.
     *
     * @param record node record
     * @param launchParameters parameters assigned by the launch files
     * @return node instance; a stub with one warning when no model is registered
     */
    public ResolvedNodeInstance resolve(ResolvedNodeRecord record, Map<String, Object> launchParameters) {
        String packageName = record.packageName();
        String executable = record.executable();
        boolean nodelet = false;

        if (NODELET_PACKAGE.equals(packageName) && NODELET_EXECUTABLE.equals(executable)) {
            Optional<String[]> target = nodeletTarget(record.args());
            if (target.isEmpty()) {
                log.debug("Node {} is a nodelet manager", record.fullName());
                return new ResolvedNodeInstance(record, true, true, List.of(), List.of());
            }
            packageName = target.get()[0];
            executable = target.get()[1];
            nodelet = true;
        }

        Optional<NodeModel> model = registry.lookup(packageName, executable);
        if (model.isEmpty()) {
            String key = NodeModel.key(packageName, executable);
            log.warn("No node model for {} ({})", key, record.fullName());
            Diagnostic warning = new Diagnostic(DiagnosticKind.UNKNOWN_NODE_MODEL, record.fullName(),
                "No node model registered for " + key, record.location());
            return new ResolvedNodeInstance(record, false, nodelet, List.of(), List.of(warning));
        }

        ModelContext context = new ModelContext(record, launchParameters);
        List<Diagnostic> failures = new ArrayList<>();
        try {
            model.get().declare(context);
        } catch (RuntimeException e) {
            log.warn("Node model {} failed for {}: {}", model.get().getDescription(), record.fullName(), e.getMessage());
            log.debug("Node model failure", e);
            failures.add(new Diagnostic(DiagnosticKind.MODEL_EVALUATION, record.fullName(),
                "Node model failed: " + e.getMessage(), record.location()));
        }

        List<Diagnostic> diagnostics = new ArrayList<>(context.diagnostics());
        diagnostics.addAll(failures);
        log.debug("Resolved {} with {} declaration(s)", record.fullName(), context.declarations().size());
        return new ResolvedNodeInstance(record, true, nodelet, context.declarations(), diagnostics);
    }

    /**
     * Parses the arguments of {@code nodelet/nodelet}.
     *
     * @param args node arguments
     * @return package and type of the loaded nodelet, empty for a manager
     */
    private static Optional<String[]> nodeletTarget(String args) {
        String[] words = args.trim().split("\\s+");
        if (words.length >= 2 && ("standalone".equals(words[0]) || "load".equals(words[0]))) {
            String[] parts = words[1].split("/", 2);
            if (parts.length == 2 && !parts[0].isEmpty() && !parts[1].isEmpty()) {
                return Optional.of(parts);
            }
        }
        return Optional.empty();
    }
}
