package com.rosarchitect.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The assembled computation graph recovered from one launch evaluation.
 *
 * <p>Indexes are keyed by absolute post-remap name and iterate in name order. Nodes keep
 * launch evaluation order. Instances are immutable once built.
 *
 * @param launchFile root launch file the architecture was recovered from
 * @param nodes resolved node instances in launch evaluation order
 * @param topics topic index
 * @param services service index
 * @param actions action index
 * @param parameters parameter index
 * @param diagnostics warnings in the order they were produced
 */
public record Architecture(
    String launchFile,
    List<ResolvedNodeInstance> nodes,
    Map<String, TopicInfo> topics,
    Map<String, ServiceInfo> services,
    Map<String, ActionInfo> actions,
    Map<String, ParameterInfo> parameters,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public Architecture {
        if (launchFile == null) {
            launchFile = "";
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        topics = sorted(topics);
        services = sorted(services);
        actions = sorted(actions);
        parameters = sorted(parameters);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Finds a node by absolute name.
     *
     * @param fullName absolute node name
     * @return the node instance, if present
     */
    public Optional<ResolvedNodeInstance> node(String fullName) {
        return nodes.stream()
            .filter(node -> node.fullName().equals(fullName))
            .findFirst();
    }

    /**
     * Returns the diagnostics of the given kind.
     *
     * @param kind diagnostic kind
     * @return matching diagnostics in production order
     */
    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        return diagnostics.stream()
            .filter(diagnostic -> diagnostic.kind() == kind)
            .toList();
    }

    private static <V> Map<String, V> sorted(Map<String, V> index) {
        if (index == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(index)));
    }
}
