package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.Objects;

/**
 * {@code <param>}: assigns one parameter.
 *
 * <p>Exactly one of {@code value}, {@code textFile} or {@code command} is set. Commands
 * are never executed.
 *
 * @param name parameter name
 * @param value literal value, or null
 * @param type explicit type ({@code str}, {@code int}, {@code double}, {@code bool}, {@code yaml}), or null
 * @param textFile file whose content is the value, or null
 * @param command command whose output would be the value, or null
 * @param condition enabling condition
 * @param location source location
 */
public record ParamDirective(
    Expression name,
    Expression value,
    Expression type,
    Expression textFile,
    Expression command,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public ParamDirective {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
