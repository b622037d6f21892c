package com.rosarchitect.core.model;

/**
 * Kinds of non-fatal warnings produced while recovering an architecture.
 */
public enum DiagnosticKind {
    /** No node model is registered for a node's package and executable. */
    UNKNOWN_NODE_MODEL,
    /** Part of a node model could not be evaluated for a node. */
    MODEL_EVALUATION,
    /** Publishers and subscribers of one topic declare different types. */
    TOPIC_TYPE_MISMATCH,
    /** More than one node provides the same service. */
    SERVICE_PROVIDER_CONFLICT
}
