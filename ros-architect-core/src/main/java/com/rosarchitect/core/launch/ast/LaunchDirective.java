package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.model.SourceLocation;

/**
 * A directive of a parsed launch file.
 *
 * <p>Directives are immutable and keep their attribute values as compiled
 * {@link com.rosarchitect.core.substitution.Expression}s; nothing is resolved at parse time.
 */
public sealed interface LaunchDirective
    permits LaunchNodeSpec, IncludeDirective, GroupDirective, ArgDirective,
            ParamDirective, RosParamDirective, RemapDirective {

    /**
     * Returns where the directive appears.
     *
     * @return source location
     */
    SourceLocation location();

    /**
     * Returns the {@code if}/{@code unless} condition of the directive.
     *
     * @return condition, {@link Condition#ALWAYS} when absent
     */
    Condition condition();
}
