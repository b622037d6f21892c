package com.rosarchitect.core.model;

import java.util.Objects;

/**
 * One interface item emitted by a node model for a resolved node.
 *
 * <p>The name is the node-relative name as written in the model (relative, private or
 * absolute), before namespace resolution and remapping.
 *
 * @param kind topic, service, action or parameter
 * @param direction role of the node on this interface
 * @param name relative, pre-remap name
 * @param type declared message/service/action type, or {@link #UNKNOWN_TYPE}
 * @param dynamic whether a parameter is reconfigurable at runtime (always false for others)
 */
public record InterfaceDeclaration(
    InterfaceKind kind,
    Direction direction,
    String name,
    String type,
    boolean dynamic
) {
    /** Type used when a model could not determine the declared type. */
    public static final String UNKNOWN_TYPE = "unknown";

    /**
     * Compact constructor with validation.
     */
    public InterfaceDeclaration {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (!direction.appliesTo(kind)) {
            throw new IllegalArgumentException("direction " + direction + " is not valid for " + kind);
        }
        if (type == null || type.isBlank()) {
            type = UNKNOWN_TYPE;
        }
    }

    /**
     * Creates a declaration that is not a dynamic parameter.
     *
     * @param kind interface kind
     * @param direction role of the node
     * @param name relative name
     * @param type declared type
     * @return declaration
     */
    public static InterfaceDeclaration of(InterfaceKind kind, Direction direction, String name, String type) {
        return new InterfaceDeclaration(kind, direction, name, type, false);
    }

    /**
     * Returns true if the declared type is known.
     *
     * @return false for {@link #UNKNOWN_TYPE}
     */
    public boolean hasKnownType() {
        return !UNKNOWN_TYPE.equals(type);
    }
}
