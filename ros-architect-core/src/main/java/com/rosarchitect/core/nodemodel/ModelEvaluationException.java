package com.rosarchitect.core.nodemodel;

/**
 * Thrown by a node model when a node's configuration cannot be modeled.
 *
 * <p>Never fatal: the resolver turns it into a {@code MODEL_EVALUATION} warning and keeps
 * the declarations emitted before the failure.
 */
public class ModelEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelEvaluationException(String message) {
        super(message);
    }

    public ModelEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
