package com.rosarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Global view of one topic after remapping.
 *
 * @param name absolute topic name
 * @param types distinct declared types, sorted
 * @param publishers publishing nodes in launch evaluation order
 * @param subscribers subscribing nodes in launch evaluation order
 */
public record TopicInfo(
    String name,
    List<String> types,
    List<String> publishers,
    List<String> subscribers
) {
    /**
     * Compact constructor with validation.
     */
    public TopicInfo {
        Objects.requireNonNull(name, "name must not be null");
        types = types == null ? List.of() : List.copyOf(types);
        publishers = publishers == null ? List.of() : List.copyOf(publishers);
        subscribers = subscribers == null ? List.of() : List.copyOf(subscribers);
    }
}
