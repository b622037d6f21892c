package com.rosarchitect.core.evaluator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent set of argument bindings.
 *
 * <p>{@link #bind(String, String)} returns a new scope and leaves this one untouched, so a
 * nested scope can never leak bindings into its parent.
 */
public final class ArgumentScope {

    private static final ArgumentScope EMPTY = new ArgumentScope(Map.of());

    private final Map<String, String> bindings;

    private ArgumentScope(Map<String, String> bindings) {
        this.bindings = bindings;
    }

    public static ArgumentScope empty() {
        return EMPTY;
    }

    /**
     * Returns a scope with one more binding; an existing binding of the same name is shadowed.
     *
     * @param name argument name
     * @param value resolved value
     * @return new scope
     */
    public ArgumentScope bind(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(bindings);
        copy.put(name, value);
        return new ArgumentScope(Collections.unmodifiableMap(copy));
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Returns all visible bindings, in declaration order.
     *
     * @return unmodifiable bindings
     */
    public Map<String, String> bindings() {
        return bindings;
    }
}
