package com.rosarchitect.core.error;

/**
 * Thrown by queries for a topic that does not exist in the architecture.
 */
public class UnknownTopicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnknownTopicException(String topic) {
        super("Unknown topic: " + topic);
    }
}
