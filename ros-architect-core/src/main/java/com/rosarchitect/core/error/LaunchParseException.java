package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Thrown when a launch file or a substitution expression is malformed.
 */
public class LaunchParseException extends LaunchException {

    private static final long serialVersionUID = 1L;

    public LaunchParseException(String message, SourceLocation location) {
        super(message, location, List.of());
    }

    public LaunchParseException(String message, SourceLocation location, Throwable cause) {
        super(message, location, List.of(), cause);
    }

    public LaunchParseException(String message, SourceLocation location, List<String> includeChain) {
        super(message, location, includeChain);
    }
}
