package com.rosarchitect.core.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rosarchitect.core.model.ActionInfo;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.Diagnostic;
import com.rosarchitect.core.model.InterfaceDeclaration;
import com.rosarchitect.core.model.ParameterInfo;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.model.TopicInfo;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * JSON document of an architecture, built as a Jackson tree so that field order is fixed.
 */
public class JsonArchitectureFormatter implements ArchitectureFormatter {

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Document";
    }

    @Override
    public String format(Architecture architecture) {
        ObjectNode root = mapper.createObjectNode();
        root.put("launchFile", architecture.launchFile());

        ArrayNode nodes = root.putArray("nodes");
        for (ResolvedNodeInstance instance : architecture.nodes()) {
            nodes.add(node(instance));
        }

        ObjectNode topics = root.putObject("topics");
        for (TopicInfo topic : architecture.topics().values()) {
            ObjectNode entry = topics.putObject(topic.name());
            strings(entry, "types", topic.types());
            strings(entry, "publishers", topic.publishers());
            strings(entry, "subscribers", topic.subscribers());
        }

        ObjectNode services = root.putObject("services");
        for (ServiceInfo service : architecture.services().values()) {
            ObjectNode entry = services.putObject(service.name());
            strings(entry, "types", service.types());
            strings(entry, "providers", service.providers());
            strings(entry, "callers", service.callers());
        }

        ObjectNode actions = root.putObject("actions");
        for (ActionInfo action : architecture.actions().values()) {
            ObjectNode entry = actions.putObject(action.name());
            strings(entry, "types", action.types());
            strings(entry, "servers", action.servers());
            strings(entry, "clients", action.clients());
        }

        ObjectNode parameters = root.putObject("parameters");
        for (ParameterInfo parameter : architecture.parameters().values()) {
            ObjectNode entry = parameters.putObject(parameter.name());
            entry.put("assigned", parameter.assigned());
            entry.set("value", mapper.valueToTree(parameter.value()));
            entry.put("dynamic", parameter.dynamic());
            strings(entry, "owners", parameter.owners());
            strings(entry, "readers", parameter.readers());
            strings(entry, "writers", parameter.writers());
        }

        ArrayNode warnings = root.putArray("warnings");
        for (Diagnostic diagnostic : architecture.diagnostics()) {
            ObjectNode entry = warnings.addObject();
            entry.put("kind", diagnostic.kind().name());
            entry.put("subject", diagnostic.subject());
            entry.put("message", diagnostic.message());
            entry.put("location", diagnostic.location() == null ? null : diagnostic.location().toString());
        }

        try {
            return mapper.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render architecture as JSON", e);
        }
    }

    private ObjectNode node(ResolvedNodeInstance instance) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", instance.fullName());
        node.put("package", instance.record().packageName());
        node.put("executable", instance.record().executable());
        node.put("namespace", instance.record().namespace());
        node.put("args", instance.record().args());
        node.put("modeled", instance.modeled());
        node.put("nodelet", instance.nodelet());
        node.put("location", instance.record().location().toString());

        ObjectNode remappings = node.putObject("remappings");
        for (Map.Entry<String, String> remap : instance.record().remappings().entrySet()) {
            remappings.put(remap.getKey(), remap.getValue());
        }

        ArrayNode interfaces = node.putArray("interfaces");
        for (InterfaceDeclaration declaration : instance.interfaces()) {
            ObjectNode entry = interfaces.addObject();
            entry.put("kind", declaration.kind().name());
            entry.put("direction", declaration.direction().name());
            entry.put("name", declaration.name());
            entry.put("type", declaration.type());
        }
        return node;
    }

    private static void strings(ObjectNode parent, String field, List<String> values) {
        ArrayNode array = parent.putArray(field);
        values.forEach(array::add);
    }
}
