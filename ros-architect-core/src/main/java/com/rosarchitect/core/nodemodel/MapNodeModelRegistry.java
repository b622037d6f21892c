package com.rosarchitect.core.nodemodel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registry over a fixed set of models.
 *
 * <pre>{@code
 * NodeModelRegistry registry = MapNodeModelRegistry.builder()
 *     .register(new ImageRepublishModel())
 *     .registerAll(new DescriptorModelLoader().load(path))
 *     .build();
 * }</pre>
 */
public final class MapNodeModelRegistry implements NodeModelRegistry {

    private final Map<String, NodeModel> models;

    private MapNodeModelRegistry(Map<String, NodeModel> models) {
        this.models = Collections.unmodifiableMap(new TreeMap<>(models));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MapNodeModelRegistry empty() {
        return new MapNodeModelRegistry(Map.of());
    }

    @Override
    public Optional<NodeModel> lookup(String packageName, String executable) {
        return Optional.ofNullable(models.get(NodeModel.key(packageName, executable)));
    }

    @Override
    public List<NodeModel> models() {
        return List.copyOf(models.values());
    }

    /**
     * Builder rejecting duplicate registrations.
     */
    public static final class Builder {
        private final Map<String, NodeModel> models = new TreeMap<>();

        private Builder() {
        }

        /**
         * Registers a model.
         *
         * @param model node model
         * @return this builder
         * @throws IllegalArgumentException if a model with the same key is already registered
         */
        public Builder register(NodeModel model) {
            String key = NodeModel.key(model.getPackageName(), model.getExecutable());
            if (models.putIfAbsent(key, model) != null) {
                throw new IllegalArgumentException("Model already registered for " + key);
            }
            return this;
        }

        public Builder registerAll(Collection<? extends NodeModel> additional) {
            new ArrayList<>(additional).forEach(this::register);
            return this;
        }

        public MapNodeModelRegistry build() {
            return new MapNodeModelRegistry(models);
        }
    }
}
