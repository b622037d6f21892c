package com.rosarchitect.core.substitution;

import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Compiles attribute text into an {@link Expression} tree.
 *
 * <p>Supported substitutions: {@code arg}, {@code env}, {@code optenv}, {@code find},
 * {@code anon}, {@code dirname} and {@code param}. Substitutions do not nest: a {@code $}
 * inside a substitution body is a parse error.
 */
public final class SubstitutionParser {

    private static final String OPEN = "$(";
    private static final char CLOSE = ')';
    private static final char DOLLAR = '$';

    private SubstitutionParser() {
        // Utility class
    }

    /**
     * Compiles a value.
     *
     * @param text raw attribute value
     * @param location location of the attribute, used in errors and substitution nodes
     * @return compiled expression
     * @throws LaunchParseException if a substitution is unterminated, nested, unknown or has
     *         the wrong number of arguments
     */
    public static Expression parse(String text, SourceLocation location) {
        if (text == null) {
            return null;
        }

        List<Expression> parts = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            int start = text.indexOf(OPEN, position);
            if (start < 0) {
                parts.add(new Expression.Literal(text.substring(position)));
                break;
            }
            if (start > position) {
                parts.add(new Expression.Literal(text.substring(position, start)));
            }
            int end = text.indexOf(CLOSE, start + OPEN.length());
            if (end < 0) {
                throw new LaunchParseException("Unterminated substitution in '" + text + "'", location);
            }
            String body = text.substring(start + OPEN.length(), end);
            if (body.indexOf(DOLLAR) >= 0) {
                throw new LaunchParseException("Nested substitution in '" + text + "'", location);
            }
            parts.add(compile(body, text, location));
            position = end + 1;
        }

        if (parts.isEmpty()) {
            return new Expression.Literal("");
        }
        return parts.size() == 1 ? parts.get(0) : new Expression.Concat(parts);
    }

    private static Expression compile(String body, String text, SourceLocation location) {
        String[] words = body.trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            throw new LaunchParseException("Empty substitution in '" + text + "'", location);
        }

        String kind = words[0];
        List<String> args = Arrays.asList(words).subList(1, words.length);
        return switch (kind) {
            case "arg" -> new Expression.Arg(single(kind, args, text, location), location);
            case "env" -> new Expression.Env(single(kind, args, text, location), null, location);
            case "optenv" -> new Expression.Env(first(kind, args, text, location), rest(args, ""), location);
            case "find" -> new Expression.Find(single(kind, args, text, location), location);
            case "anon" -> new Expression.Anon(single(kind, args, text, location), location);
            case "dirname" -> {
                if (!args.isEmpty()) {
                    throw new LaunchParseException("$(dirname) takes no arguments in '" + text + "'", location);
                }
                yield new Expression.Dirname(location);
            }
            case "param" -> new Expression.Param(first(kind, args, text, location), rest(args, null), location);
            case "eval" -> throw new LaunchParseException(
                "$(eval) substitutions are not supported in '" + text + "'", location);
            default -> throw new LaunchParseException(
                "Unknown substitution '" + kind + "' in '" + text + "'", location);
        };
    }

    private static String single(String kind, List<String> args, String text, SourceLocation location) {
        if (args.size() != 1) {
            throw new LaunchParseException(
                "$(" + kind + ") expects exactly one argument in '" + text + "'", location);
        }
        return args.get(0);
    }

    private static String first(String kind, List<String> args, String text, SourceLocation location) {
        if (args.isEmpty()) {
            throw new LaunchParseException("$(" + kind + ") expects an argument in '" + text + "'", location);
        }
        return args.get(0);
    }

    private static String rest(List<String> args, String whenAbsent) {
        if (args.size() < 2) {
            return whenAbsent;
        }
        return String.join(" ", args.subList(1, args.size()));
    }
}
