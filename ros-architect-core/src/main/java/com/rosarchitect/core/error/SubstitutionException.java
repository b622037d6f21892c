package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Thrown when a substitution cannot be evaluated: an unknown package, a missing
 * environment variable, a value that is not a boolean where one is required, or a
 * substitution that is not available in the current context.
 */
public class SubstitutionException extends LaunchException {

    private static final long serialVersionUID = 1L;

    public SubstitutionException(String message, SourceLocation location) {
        super(message, location, List.of());
    }

    public SubstitutionException(String message, SourceLocation location, List<String> includeChain) {
        super(message, location, includeChain);
    }
}
