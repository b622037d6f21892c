package com.rosarchitect.core.model;

/**
 * Kind of communication interface a node declares.
 */
public enum InterfaceKind {
    TOPIC,
    SERVICE,
    ACTION,
    PARAMETER
}
