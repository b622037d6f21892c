package com.rosarchitect.core.nodemodel.descriptor;

/**
 * Thrown when a model descriptor file cannot be read or compiled.
 */
public class ModelDescriptorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelDescriptorException(String message) {
        super(message);
    }

    public ModelDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
