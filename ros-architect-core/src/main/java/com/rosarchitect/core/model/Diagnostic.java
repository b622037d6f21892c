package com.rosarchitect.core.model;

import java.util.Objects;

/**
 * A non-fatal warning attached to a recovered architecture.
 *
 * @param kind warning kind
 * @param subject absolute name of the node, topic or service concerned
 * @param message human-readable description
 * @param location launch file location, or null when not tied to a directive
 */
public record Diagnostic(
    DiagnosticKind kind,
    String subject,
    String message,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        String where = location == null ? "" : " (" + location + ")";
        return kind + " [" + subject + "]: " + message + where;
    }
}
