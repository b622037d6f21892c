package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Thrown when an included launch file or a referenced parameter file cannot be read.
 */
public class IncludeResolutionException extends LaunchException {

    private static final long serialVersionUID = 1L;

    public IncludeResolutionException(String message, Throwable cause) {
        super(message, null, List.of(), cause);
    }

    public IncludeResolutionException(String message, SourceLocation location, List<String> includeChain,
                                      Throwable cause) {
        super(message, location, includeChain, cause);
    }
}
