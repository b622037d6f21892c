package com.rosarchitect.core.evaluator;

import com.rosarchitect.core.launch.LaunchSource;
import com.rosarchitect.core.util.RosNames;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable evaluation scope.
 *
 * <p>Entering a group or an include creates a child scope seeded from its parent; the
 * parent scope is not modified and evaluation continues with it once the child's
 * directives are done.
 *
 * @param namespace accumulated absolute namespace
 * @param arguments visible argument bindings
 * @param overrides argument values passed at the scope site (CLI overrides for the root
 *                  file and its groups, {@code <arg>} children for includes)
 * @param remaps remappings applying to nodes launched in this scope
 * @param condition logical AND of all enclosing conditions
 * @param source launch file being evaluated
 * @param includeStack launch files on the include stack, root first, ending with {@code source}
 * @param declared arguments declared in {@code source} by this scope or an enclosing group
 */
public record EvaluationScope(
    String namespace,
    ArgumentScope arguments,
    Map<String, String> overrides,
    RemapTable remaps,
    boolean condition,
    LaunchSource source,
    List<String> includeStack,
    Set<String> declared
) {
    public EvaluationScope {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        Objects.requireNonNull(remaps, "remaps must not be null");
        Objects.requireNonNull(source, "source must not be null");
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        includeStack = includeStack == null ? List.of() : List.copyOf(includeStack);
        declared = declared == null ? Set.of() : Set.copyOf(declared);
    }

    /**
     * Creates the scope of the root launch file.
     *
     * @param source root launch file
     * @param overrides top-level argument overrides
     * @return root scope
     */
    public static EvaluationScope root(LaunchSource source, Map<String, String> overrides) {
        return new EvaluationScope(RosNames.ROOT, ArgumentScope.empty(), overrides, RemapTable.empty(),
            true, source, List.of(source.path()), Set.of());
    }

    public EvaluationScope withArgument(String name, String value) {
        return new EvaluationScope(namespace, arguments.bind(name, value), overrides, remaps, condition,
            source, includeStack, declared);
    }

    /**
     * Records an argument declaration of the current file.
     *
     * @param name argument name
     * @return scope in which {@code name} counts as declared
     */
    public EvaluationScope withDeclaration(String name) {
        Set<String> names = new HashSet<>(declared);
        names.add(name);
        return new EvaluationScope(namespace, arguments, overrides, remaps, condition, source, includeStack, names);
    }

    public EvaluationScope withRemap(String from, String to) {
        return new EvaluationScope(namespace, arguments, overrides, remaps.with(from, to), condition,
            source, includeStack, declared);
    }

    /**
     * Creates the scope of a {@code <group>}.
     *
     * @param groupNamespace resolved {@code ns} attribute, or null
     * @param enabled the group's own condition
     * @return child scope
     */
    public EvaluationScope enterGroup(String groupNamespace, boolean enabled) {
        return new EvaluationScope(childNamespace(groupNamespace), arguments, overrides, remaps,
            condition && enabled, source, includeStack, declared);
    }

    /**
     * Creates the scope of an {@code <include>}.
     *
     * @param included included launch file
     * @param includeNamespace resolved {@code ns} attribute, or null
     * @param includeOverrides arguments passed at the include site
     * @param enabled the include's own condition
     * @return child scope
     */
    public EvaluationScope enterInclude(LaunchSource included, String includeNamespace,
                                        Map<String, String> includeOverrides, boolean enabled) {
        List<String> stack = new ArrayList<>(includeStack);
        stack.add(included.path());
        return new EvaluationScope(childNamespace(includeNamespace), arguments, includeOverrides, remaps,
            condition && enabled, included, stack, Set.of());
    }

    /**
     * Returns the include stack extended with a file, as reported in cycle errors.
     *
     * @param path file that would be included next
     * @return include chain ending with {@code path}
     */
    public List<String> includeChainWith(String path) {
        List<String> chain = new ArrayList<>(includeStack);
        chain.add(path);
        return chain;
    }

    private String childNamespace(String child) {
        if (child == null || child.isBlank()) {
            return namespace;
        }
        return RosNames.resolve(child, namespace);
    }
}
