package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;

import java.util.Objects;

/**
 * {@code <rosparam>}: loads YAML parameters from a file or inline text, or deletes them.
 *
 * @param command load, delete or dump
 * @param file YAML file, or null for inline text
 * @param namespace namespace the parameters are loaded into, or null
 * @param param parameter name the whole document is assigned to, or null
 * @param inlineText inline YAML, empty when absent
 * @param substituteValue whether {@code $(...)} inside the YAML is resolved
 * @param condition enabling condition
 * @param location source location
 */
public record RosParamDirective(
    RosParamCommand command,
    Expression file,
    Expression namespace,
    Expression param,
    String inlineText,
    boolean substituteValue,
    Condition condition,
    SourceLocation location
) implements LaunchDirective {

    public RosParamDirective {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (inlineText == null) {
            inlineText = "";
        }
        if (condition == null) {
            condition = Condition.ALWAYS;
        }
    }
}
