package com.rosarchitect.core.nodemodel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registry delegating to several registries; the first registry knowing a key wins.
 *
 * <p>Used to let user-supplied descriptor models shadow the built-in ones.
 */
public final class CompositeNodeModelRegistry implements NodeModelRegistry {

    private final List<NodeModelRegistry> delegates;

    public CompositeNodeModelRegistry(List<NodeModelRegistry> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public Optional<NodeModel> lookup(String packageName, String executable) {
        for (NodeModelRegistry delegate : delegates) {
            Optional<NodeModel> model = delegate.lookup(packageName, executable);
            if (model.isPresent()) {
                return model;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<NodeModel> models() {
        Map<String, NodeModel> merged = new LinkedHashMap<>();
        for (NodeModelRegistry delegate : delegates) {
            for (NodeModel model : delegate.models()) {
                merged.putIfAbsent(NodeModel.key(model.getPackageName(), model.getExecutable()), model);
            }
        }
        return new ArrayList<>(new TreeMap<>(merged).values());
    }
}
