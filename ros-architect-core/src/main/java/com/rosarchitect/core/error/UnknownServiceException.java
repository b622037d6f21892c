package com.rosarchitect.core.error;

/**
 * Thrown by queries for a service that does not exist in the architecture.
 */
public class UnknownServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnknownServiceException(String service) {
        super("Unknown service: " + service);
    }
}
