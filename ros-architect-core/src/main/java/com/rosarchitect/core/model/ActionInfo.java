package com.rosarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Global view of one action after remapping.
 *
 * @param name absolute action namespace
 * @param types distinct declared action types, sorted
 * @param servers action servers in launch evaluation order
 * @param clients action clients in launch evaluation order
 */
public record ActionInfo(
    String name,
    List<String> types,
    List<String> servers,
    List<String> clients
) {
    /**
     * Compact constructor with validation.
     */
    public ActionInfo {
        Objects.requireNonNull(name, "name must not be null");
        types = types == null ? List.of() : List.copyOf(types);
        servers = servers == null ? List.of() : List.copyOf(servers);
        clients = clients == null ? List.of() : List.copyOf(clients);
    }
}
