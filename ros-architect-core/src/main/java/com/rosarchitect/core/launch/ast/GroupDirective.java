package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.List;
import java.util.Objects;

/**
 * {@code <group>}: scopes namespace, remaps, arguments and condition for its children.
 *
 * @param namespace {@code ns} attribute, or null
 * @param children nested directives in document order
 * @param condition enabling condition
 * @param location source location
 */
public record GroupDirective(
    Expression namespace,
    List<LaunchDirective> children,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public GroupDirective {
        Objects.requireNonNull(location, "location must not be null");
        children = children == null ? List.of() : List.copyOf(children);
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
