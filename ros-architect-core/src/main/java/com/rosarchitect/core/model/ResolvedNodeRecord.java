package com.rosarchitect.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node launch directive after every substitution has been resolved.
 *
 * @param order position of the node in launch evaluation order (0-based)
 * @param packageName ROS package of the executable
 * @param executable executable ({@code type} attribute)
 * @param name base name of the node
 * @param namespace absolute namespace, {@code /} for the root namespace
 * @param fullName absolute node name
 * @param args command-line arguments string, empty if none
 * @param remappings final remap table: enclosing-scope entries first, node entries after
 * @param parameters parameters assigned inside the node element, keyed by absolute name
 * @param location where the node directive appears
 * @param includeChain launch files included to reach the directive, root first
 */
public record ResolvedNodeRecord(
    int order,
    String packageName,
    String executable,
    String name,
    String namespace,
    String fullName,
    String args,
    Map<String, String> remappings,
    Map<String, Object> parameters,
    SourceLocation location,
    List<String> includeChain
) {
    /**
     * Compact constructor with validation.
     */
    public ResolvedNodeRecord {
        Objects.requireNonNull(packageName, "packageName must not be null");
        Objects.requireNonNull(executable, "executable must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(fullName, "fullName must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (args == null) {
            args = "";
        }
        remappings = remappings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(remappings));
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        includeChain = includeChain == null ? List.of() : List.copyOf(includeChain);
    }
}
