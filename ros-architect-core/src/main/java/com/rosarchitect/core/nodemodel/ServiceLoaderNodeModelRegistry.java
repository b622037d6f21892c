package com.rosarchitect.core.nodemodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Registry of the models contributed by every {@link NodeModelProvider} on the classpath.
 *
 * <p>Providers are applied in identifier order so that discovery is deterministic; two
 * providers registering the same key is a configuration error.
 */
public final class ServiceLoaderNodeModelRegistry implements NodeModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderNodeModelRegistry.class);

    private final MapNodeModelRegistry delegate;

    public ServiceLoaderNodeModelRegistry() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderNodeModelRegistry(ClassLoader classLoader) {
        List<NodeModelProvider> providers = ServiceLoader.load(NodeModelProvider.class, classLoader).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(NodeModelProvider::getId))
            .collect(Collectors.toList());

        MapNodeModelRegistry.Builder builder = MapNodeModelRegistry.builder();
        for (NodeModelProvider provider : providers) {
            log.debug("Loading node models from provider: {}", provider.getId());
            builder.registerAll(provider.getModels());
        }
        this.delegate = builder.build();
        log.debug("Discovered {} node model(s) from {} provider(s)", delegate.models().size(), providers.size());
    }

    @Override
    public Optional<NodeModel> lookup(String packageName, String executable) {
        return delegate.lookup(packageName, executable);
    }

    @Override
    public List<NodeModel> models() {
        return delegate.models();
    }
}
