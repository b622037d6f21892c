package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Thrown when a substitution references an argument that has no value.
 */
public class MissingArgumentException extends LaunchException {

    private static final long serialVersionUID = 1L;

    private final String argumentName;

    public MissingArgumentException(String argumentName, SourceLocation location, List<String> includeChain) {
        super("Argument '" + argumentName + "' is not set and has no default", location, includeChain);
        this.argumentName = argumentName;
    }

    /**
     * Returns the name of the missing argument.
     *
     * @return argument name
     */
    public String getArgumentName() {
        return argumentName;
    }
}
