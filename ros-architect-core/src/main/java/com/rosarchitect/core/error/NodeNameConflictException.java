package com.rosarchitect.core.error;

import com.rosarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * Thrown when two launched nodes resolve to the same absolute name.
 */
public class NodeNameConflictException extends LaunchException {

    private static final long serialVersionUID = 1L;

    private final String nodeName;
    private final SourceLocation firstLocation;

    public NodeNameConflictException(String nodeName, SourceLocation firstLocation,
                                     SourceLocation secondLocation, List<String> includeChain) {
        super("Node name " + nodeName + " is launched twice (first launched at " + firstLocation + ")",
            secondLocation, includeChain);
        this.nodeName = nodeName;
        this.firstLocation = firstLocation;
    }

    public String getNodeName() {
        return nodeName;
    }

    /**
     * Returns where the node name was first used.
     *
     * @return location of the first node with this name
     */
    public SourceLocation getFirstLocation() {
        return firstLocation;
    }
}
