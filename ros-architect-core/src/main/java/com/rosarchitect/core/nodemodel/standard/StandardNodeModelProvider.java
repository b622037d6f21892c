package com.rosarchitect.core.nodemodel.standard;

import com.rosarchitect.core.nodemodel.NodeModel;
import com.rosarchitect.core.nodemodel.NodeModelProvider;
import com.rosarchitect.core.nodemodel.descriptor.DescriptorModelLoader;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Built-in node models: {@link ImageRepublishModel} and the descriptor models bundled in
 * {@value #DESCRIPTOR_RESOURCE}.
 */
public class StandardNodeModelProvider implements NodeModelProvider {

    static final String DESCRIPTOR_RESOURCE = "nodemodels/standard-models.yaml";

    @Override
    public String getId() {
        return "standard-models";
    }

    @Override
    public Collection<NodeModel> getModels() {
        List<NodeModel> models = new ArrayList<>();
        models.add(new ImageRepublishModel());
        models.addAll(new DescriptorModelLoader().loadResource(DESCRIPTOR_RESOURCE));
        return models;
    }
}
