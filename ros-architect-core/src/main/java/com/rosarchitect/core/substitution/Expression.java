package com.rosarchitect.core.substitution;

import com.rosarchitect.core.error.SubstitutionException;
import com.rosarchitect.core.model.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Compiled form of a launch attribute value.
 *
 * <p>Attribute values mix literal text with {@code $(...)} substitutions. The
 * {@link SubstitutionParser} compiles each value once into this tagged variant so that
 * evaluation and error reporting work the same way for every attribute.
 *
 * <pre>{@code
 * Expression file = SubstitutionParser.parse("$(find nav)/launch/$(arg robot).launch", location);
 * String path = file.evaluate(context);
 * }</pre>
 */
public sealed interface Expression {

    /**
     * Evaluates the expression.
     *
     * @param context lookup capabilities of the current scope
     * @return resolved string
     * @throws com.rosarchitect.core.error.LaunchException if a lookup fails
     */
    String evaluate(SubstitutionContext context);

    /**
     * Returns the expression in launch syntax.
     *
     * @return source text equivalent of this expression
     */
    String render();

    /**
     * Returns true if the expression contains no substitution.
     *
     * @return true for plain literals
     */
    default boolean isConstant() {
        return false;
    }

    /**
     * Plain text.
     *
     * @param text literal value
     */
    record Literal(String text) implements Expression {
        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String evaluate(SubstitutionContext context) {
            return text;
        }

        @Override
        public String render() {
            return text;
        }

        @Override
        public boolean isConstant() {
            return true;
        }
    }

    /**
     * {@code $(arg NAME)}.
     *
     * @param name argument name
     * @param location where the substitution appears
     */
    record Arg(String name, SourceLocation location) implements Expression {
        @Override
        public String evaluate(SubstitutionContext context) {
            return context.argument(name, location);
        }

        @Override
        public String render() {
            return "$(arg " + name + ")";
        }
    }

    /**
     * {@code $(env VAR)} and {@code $(optenv VAR [default])}.
     *
     * @param variable environment variable name
     * @param defaultValue value when unset; null makes the variable mandatory
     * @param location where the substitution appears
     */
    record Env(String variable, String defaultValue, SourceLocation location) implements Expression {
        @Override
        public String evaluate(SubstitutionContext context) {
            return context.environment(variable)
                .or(() -> Optional.ofNullable(defaultValue))
                .orElseThrow(() -> new SubstitutionException(
                    "Environment variable '" + variable + "' is not set", location, context.includeChain()));
        }

        @Override
        public String render() {
            if (defaultValue == null) {
                return "$(env " + variable + ")";
            }
            return defaultValue.isEmpty()
                ? "$(optenv " + variable + ")"
                : "$(optenv " + variable + " " + defaultValue + ")";
        }
    }

    /**
     * {@code $(find PKG)}.
     *
     * @param packageName ROS package name
     * @param location where the substitution appears
     */
    record Find(String packageName, SourceLocation location) implements Expression {
        @Override
        public String evaluate(SubstitutionContext context) {
            return context.packagePath(packageName, location);
        }

        @Override
        public String render() {
            return "$(find " + packageName + ")";
        }
    }

    /**
     * {@code $(anon NAME)}.
     *
     * @param name base name
     * @param location where the substitution appears
     */
    record Anon(String name, SourceLocation location) implements Expression {
        @Override
        public String evaluate(SubstitutionContext context) {
            return context.anonymousName(name, location);
        }

        @Override
        public String render() {
            return "$(anon " + name + ")";
        }
    }

    /**
     * {@code $(dirname)}.
     *
     * @param location where the substitution appears
     */
    record Dirname(SourceLocation location) implements Expression {
        @Override
        public String evaluate(SubstitutionContext context) {
            return context.currentDirectory(location);
        }

        @Override
        public String render() {
            return "$(dirname)";
        }
    }

    /**
     * {@code $(param NAME [default])}, only meaningful inside node models.
     *
     * @param name parameter name, relative to the node
     * @param defaultValue fallback value, or null if the parameter is required
     * @param location where the substitution appears
     */
    record Param(String name, String defaultValue, SourceLocation location) implements Expression {
        @Override
        public String evaluate(SubstitutionContext context) {
            return context.parameter(name, defaultValue, location);
        }

        @Override
        public String render() {
            return defaultValue == null
                ? "$(param " + name + ")"
                : "$(param " + name + " " + defaultValue + ")";
        }
    }

    /**
     * Sequence of parts evaluated and joined.
     *
     * @param parts expression parts in textual order
     */
    record Concat(List<Expression> parts) implements Expression {
        public Concat {
            parts = List.copyOf(parts);
        }

        @Override
        public String evaluate(SubstitutionContext context) {
            StringBuilder sb = new StringBuilder();
            for (Expression part : parts) {
                sb.append(part.evaluate(context));
            }
            return sb.toString();
        }

        @Override
        public String render() {
            return parts.stream().map(Expression::render).collect(Collectors.joining());
        }

        @Override
        public boolean isConstant() {
            return parts.stream().allMatch(Expression::isConstant);
        }
    }
}
