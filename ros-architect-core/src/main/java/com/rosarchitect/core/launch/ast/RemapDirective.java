package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.Objects;

/**
 * {@code <remap from=".." to=".."/>}.
 *
 * @param from name used by the node
 * @param to name it is mapped to
 * @param condition enabling condition
 * @param location source location
 */
public record RemapDirective(
    Expression from,
    Expression to,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public RemapDirective {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
