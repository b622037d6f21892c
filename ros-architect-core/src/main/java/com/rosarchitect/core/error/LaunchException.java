package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Base class of fatal errors that abort an architecture recovery run.
 *
 * <p>Every fatal error identifies the offending directive through its source location
 * and the chain of launch files included to reach it.
 */
public class LaunchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final SourceLocation location;
    private final List<String> includeChain;

    /**
     * Creates a new launch exception.
     *
     * @param message error description
     * @param location offending directive location, may be null
     * @param includeChain launch files on the include stack, root first
     */
    public LaunchException(String message, SourceLocation location, List<String> includeChain) {
        this(message, location, includeChain, null);
    }

    /**
     * Creates a new launch exception with a cause.
     *
     * @param message error description
     * @param location offending directive location, may be null
     * @param includeChain launch files on the include stack, root first
     * @param cause underlying cause
     */
    public LaunchException(String message, SourceLocation location, List<String> includeChain, Throwable cause) {
        super(message, cause);
        this.location = location;
        this.includeChain = includeChain == null ? List.of() : List.copyOf(includeChain);
    }

    /**
     * Returns the location of the offending directive.
     *
     * @return location, or null when unknown
     */
    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Returns the include chain leading to the offending directive.
     *
     * @return launch files, root first
     */
    public List<String> getIncludeChain() {
        return includeChain;
    }

    /**
     * Formats the error with its location and include chain for CLI output.
     *
     * @return multi-line diagnostic
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (location != null) {
            sb.append("\n  at ").append(location);
        }
        if (!includeChain.isEmpty()) {
            sb.append("\n  include chain: ").append(String.join(" -> ", includeChain));
        }
        return sb.toString();
    }
}
