package com.rosarchitect.core.error;

/**
 * Thrown by queries for a node that does not exist in the architecture.
 */
public class UnknownNodeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnknownNodeException(String node) {
        super("Unknown node: " + node);
    }
}
