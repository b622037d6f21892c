package com.rosarchitect.core.launch.ast;

import com.rosarchitect.core.substitution.Expression;

/**
 * The {@code if} and {@code unless} attributes of a directive.
 *
 * @param ifExpression must evaluate to true, or null
 * @param unlessExpression must evaluate to false, or null
 */
public record Condition(
    Expression ifExpression,
    Expression unlessExpression
) {
    /** Condition of a directive without {@code if}/{@code unless}. */
    public static final Condition ALWAYS = new Condition(null, null);

    /**
     * Returns true if the directive has no condition.
     *
     * @return true when neither attribute is present
     */
    public boolean isAlways() {
        return ifExpression == null && unlessExpression == null;
    }
}
