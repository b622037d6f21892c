package com.rosarchitect.core.evaluator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistent, ordered table of name remappings.
 *
 * <p>Entries keep insertion order; adding an existing key replaces its target.
 */
public final class RemapTable {

    private static final RemapTable EMPTY = new RemapTable(Map.of());

    private final Map<String, String> entries;

    private RemapTable(Map<String, String> entries) {
        this.entries = entries;
    }

    public static RemapTable empty() {
        return EMPTY;
    }

    /**
     * Returns a table with one more remapping.
     *
     * @param from name as used by nodes
     * @param to replacement name
     * @return new table
     */
    public RemapTable with(String from, String to) {
        Map<String, String> copy = new LinkedHashMap<>(entries);
        copy.put(from, to);
        return new RemapTable(Collections.unmodifiableMap(copy));
    }

    public Map<String, String> entries() {
        return entries;
    }
}
