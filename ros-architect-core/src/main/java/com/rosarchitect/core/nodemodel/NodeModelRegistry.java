package com.rosarchitect.core.nodemodel;

import java.util.List;
import java.util.Optional;

/**
 * Capability looking up node models by package and executable.
 *
 * @see MapNodeModelRegistry
 * @see CompositeNodeModelRegistry
 * @see ServiceLoaderNodeModelRegistry
 */
public interface NodeModelRegistry {

    /**
     * Finds the model of an executable.
     *
     * @param packageName ROS package
     * @param executable executable name
     * @return model, or empty if none is registered
     */
    Optional<NodeModel> lookup(String packageName, String executable);

    /**
     * Returns every registered model, sorted by key.
     *
     * @return registered models
     */
    List<NodeModel> models();
}
