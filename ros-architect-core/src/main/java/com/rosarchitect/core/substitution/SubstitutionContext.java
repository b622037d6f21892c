package com.rosarchitect.core.substitution;

import com.rosarchitect.core.error.SubstitutionException;
import com.rosarchitect.core.model.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * Lookup capabilities available to {@link Expression#evaluate(SubstitutionContext)}.
 *
 * <p>Each evaluation site implements the lookups it supports. The defaults reject the
 * substitution, so for example {@code $(param)} fails inside a launch file and
 * {@code $(arg)} fails inside a node model.
 */
public interface SubstitutionContext {

    /**
     * Resolves {@code $(arg NAME)}.
     *
     * @param name argument name
     * @param location substitution location
     * @return argument value
     */
    default String argument(String name, SourceLocation location) {
        throw unsupported("arg", location);
    }

    /**
     * Looks up an environment variable.
     *
     * @param variable variable name
     * @return value, or empty if unset
     */
    default Optional<String> environment(String variable) {
        return Optional.empty();
    }

    /**
     * Resolves {@code $(find PKG)}.
     *
     * @param packageName package name
     * @param location substitution location
     * @return package directory
     */
    default String packagePath(String packageName, SourceLocation location) {
        throw unsupported("find", location);
    }

    /**
     * Resolves {@code $(anon NAME)}.
     *
     * @param base base name
     * @param location substitution location
     * @return anonymous name, stable for the same base within one run
     */
    default String anonymousName(String base, SourceLocation location) {
        throw unsupported("anon", location);
    }

    /**
     * Resolves {@code $(dirname)}.
     *
     * @param location substitution location
     * @return directory of the current launch file
     */
    default String currentDirectory(SourceLocation location) {
        throw unsupported("dirname", location);
    }

    /**
     * Resolves {@code $(param NAME [default])}.
     *
     * @param name parameter name
     * @param defaultValue fallback, or null when the parameter is required
     * @param location substitution location
     * @return parameter value as a string
     */
    default String parameter(String name, String defaultValue, SourceLocation location) {
        throw unsupported("param", location);
    }

    /**
     * Returns the include chain used when reporting failures.
     *
     * @return launch files, root first
     */
    default List<String> includeChain() {
        return List.of();
    }

    private SubstitutionException unsupported(String kind, SourceLocation location) {
        return new SubstitutionException("$(" + kind + ") is not available here", location, includeChain());
    }
}
