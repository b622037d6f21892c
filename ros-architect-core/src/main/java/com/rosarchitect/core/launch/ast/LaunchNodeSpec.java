package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.List;
import java.util.Objects;

/**
 * {@code <node>}: an unresolved node launch.
 *
 * @param packageName {@code pkg} attribute
 * @param executable {@code type} attribute
 * @param name {@code name} attribute
 * @param namespace {@code ns} attribute, or null
 * @param args {@code args} attribute, or null
 * @param remaps node-level remaps in document order
 * @param parameters node-private {@link ParamDirective}s and {@link RosParamDirective}s
 * @param condition enabling condition
 * @param location source location
 */
public record LaunchNodeSpec(
    Expression packageName,
    Expression executable,
    Expression name,
    Expression namespace,
    Expression args,
    List<RemapDirective> remaps,
    List<LaunchDirective> parameters,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public LaunchNodeSpec {
        Objects.requireNonNull(packageName, "packageName must not be null");
        Objects.requireNonNull(executable, "executable must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        remaps = remaps == null ? List.of() : List.copyOf(remaps);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        for (LaunchDirective parameter : parameters) {
            if (!(parameter instanceof ParamDirective) && !(parameter instanceof RosParamDirective)) {
                throw new IllegalArgumentException("Node parameters must be <param> or <rosparam>: " + parameter);
            }
        }
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
