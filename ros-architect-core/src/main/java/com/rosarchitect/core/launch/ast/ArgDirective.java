package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.Objects;

/**
 * {@code <arg>}: declares an argument, or passes one when nested in {@code <include>}.
 *
 * @param name argument name
 * @param defaultValue overridable default, or null
 * @param value fixed value, or null
 * @param condition enabling condition
 * @param location source location
 */
public record ArgDirective(
    String name,
    Expression defaultValue,
    Expression value,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public ArgDirective {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
