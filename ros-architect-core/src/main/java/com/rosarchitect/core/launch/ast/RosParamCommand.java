package com.rosarchitect.core.launch.ast;

/**
 * The {@code command} attribute of {@code <rosparam>}.
 */
public enum RosParamCommand {
    LOAD,
    DELETE,
    DUMP
}
