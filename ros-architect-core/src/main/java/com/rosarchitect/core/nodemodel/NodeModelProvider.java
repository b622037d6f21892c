package com.rosarchitect.core.nodemodel;

import java.util.Collection;

/**
 * Service provider contributing node models.
 *
 * <p>Providers are discovered via Java Service Provider Interface (SPI) by
 * {@link ServiceLoaderNodeModelRegistry}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.rosarchitect.core.nodemodel.NodeModelProvider}
 */
public interface NodeModelProvider {

    /**
     * Returns unique identifier for this provider (kebab-case, e.g. "standard-models").
     *
     * @return provider identifier
     */
    String getId();

    /**
     * Returns the models contributed by this provider.
     *
     * @return node models
     */
    Collection<NodeModel> getModels();
}
