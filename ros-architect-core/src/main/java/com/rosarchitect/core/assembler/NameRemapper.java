package com.rosarchitect.core.assembler;

import com.rosarchitect.core.model.ResolvedNodeRecord;
import com.rosarchitect.core.util.RosNames;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves and remaps names declared by one node.
 *
 * <p>Both sides of every remap entry are resolved in the node's context. Entries are
 * applied in table order, so a later entry for the same source name replaces an earlier
 * one. A name is remapped at most once.
 */
final class NameRemapper {

    private final ResolvedNodeRecord record;
    private final Map<String, String> remaps = new HashMap<>();

    NameRemapper(ResolvedNodeRecord record) {
        this.record = record;
        for (Map.Entry<String, String> entry : record.remappings().entrySet()) {
            remaps.put(resolve(entry.getKey()), resolve(entry.getValue()));
        }
    }

    /**
     * Resolves a name against the node without remapping (used for parameters).
     *
     * @param name relative, private or absolute name
     * @return absolute name
     */
    String resolve(String name) {
        return RosNames.resolve(name, record.namespace(), record.fullName());
    }

    /**
     * Resolves and remaps a topic, service or action name.
     *
     * @param name relative, private or absolute name
     * @return absolute post-remap name
     */
    String remap(String name) {
        String resolved = resolve(name);
        return remaps.getOrDefault(resolved, resolved);
    }
}
