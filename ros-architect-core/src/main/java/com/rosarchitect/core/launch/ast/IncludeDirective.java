package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.List;
import java.util.Objects;

/**
 * {@code <include>}: evaluates another launch file in a nested scope.
 *
 * @param file path expression of the included file
 * @param namespace {@code ns} attribute, or null
 * @param passAllArgs {@code pass_all_args} attribute, or null
 * @param args arguments passed to the included file
 * @param condition enabling condition
 * @param location source location
 */
public record IncludeDirective(
    Expression file,
    Expression namespace,
    Expression passAllArgs,
    List<ArgDirective> args,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public IncludeDirective {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(location, "location must not be null");
        args = args == null ? List.of() : List.copyOf(args);
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
