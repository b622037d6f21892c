package com.rosarchitect.core.nodemodel.descriptor;

import com.rosarchitect.core.model.Direction;
import com.rosarchitect.core.model.InterfaceKind;
import com.rosarchitect.core.substitution.Expression;

import java.util.Objects;

/**
 * Compiled interface template of a descriptor model.
 *
 * @param kind interface kind
 * @param direction role of the node
 * @param name name expression
 * @param type type expression, or null when unknown
 * @param condition condition expression, or null when unconditional
 * @param dynamic reconfigurable parameter flag
 */
public record InterfaceTemplate(
    InterfaceKind kind,
    Direction direction,
    Expression name,
    Expression type,
    Expression condition,
    boolean dynamic
) {
    public InterfaceTemplate {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (!direction.appliesTo(kind)) {
            throw new IllegalArgumentException("direction " + direction + " is not valid for " + kind);
        }
    }
}
