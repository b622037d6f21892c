package com.rosarchitect.core.substitution;

import com.rosarchitect.core.error.SubstitutionException;
import com.rosarchitect.core.model.SourceLocation;

import java.util.List;
import java.util.Locale;

/**
 * Boolean interpretation of resolved substitution values.
 */
public final class BooleanValues {

    private BooleanValues() {
        // Utility class
    }

    /**
     * Converts {@code true}/{@code 1} and {@code false}/{@code 0}, ignoring case and
     * surrounding whitespace.
     *
     * @param value resolved value
     * @param location location of the expression that produced the value
     * @param includeChain include chain for error reporting
     * @return boolean value
     * @throws SubstitutionException for any other value
     */
    public static boolean parse(String value, SourceLocation location, List<String> includeChain) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new SubstitutionException(
                "Value '" + value + "' is not a boolean", location, includeChain);
        };
    }
}
