package com.rosarchitect.core.model;

import java.util.Objects;

/**
 * Position of a directive inside a launch file.
 *
 * @param source launch file path as given to the source resolver
 * @param line 1-based line number, or 0 when unknown
 * @param column 1-based column number, or 0 when unknown
 */
public record SourceLocation(
    String source,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Creates a location that only knows its source file.
     *
     * @param source launch file path
     * @return location without line information
     */
    public static SourceLocation of(String source) {
        return new SourceLocation(source, 0, 0);
    }

    @Override
    public String toString() {
        if (line <= 0) {
            return source;
        }
        return source + ":" + line + ":" + column;
    }
}
