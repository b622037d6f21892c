package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Thrown when an include chain revisits a launch file that is already being evaluated.
 *
 * <p>The include chain ends with the file that closes the cycle.
 */
public class CyclicIncludeException extends LaunchException {

    private static final long serialVersionUID = 1L;

    public CyclicIncludeException(String source, SourceLocation location, List<String> includeChain) {
        super("Cyclic include of " + source + ": " + String.join(" -> ", includeChain), location, includeChain);
    }
}
